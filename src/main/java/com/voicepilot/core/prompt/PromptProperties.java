package com.voicepilot.core.prompt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "voicepilot.prompts")
public class PromptProperties {

    /** Resource location of the system instructions; a built-in prompt is used when it does not exist. */
    private String systemPrompt = "classpath:prompts/system.txt";

    /** JSON-lines resource of {@code {"user": ..., "assistant": {...}}} examples. */
    private String fewShot = "classpath:prompts/fewshot.jsonl";

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String getFewShot() {
        return fewShot;
    }

    public void setFewShot(String fewShot) {
        this.fewShot = fewShot;
    }
}
