package com.voicepilot.core.safety;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "voicepilot.safety")
public class SafetyProperties {

    /** Force confirmation when the dangerous-operation detector escalates an intent. */
    private boolean confirmDangerous = true;

    /**
     * Case-insensitive regular expressions checked in order. English words carry
     * {@code \b} boundaries so that e.g. "cleanup" in a note title is not a hit for "clean".
     */
    private List<String> dangerousPatterns = new ArrayList<>(List.of(
            "删除|\\bdelete\\b|\\bremove\\b",
            "清空|清除|\\bclear\\b|\\bclean\\b",
            "格式化|\\bformat\\b",
            "关闭.*网络|断网|\\bdisconnect\\b",
            "重启|关机|\\bshutdown\\b|\\bshut down\\b|\\brestart\\b",
            "卸载|\\buninstall\\b"));

    public boolean isConfirmDangerous() {
        return confirmDangerous;
    }

    public void setConfirmDangerous(boolean confirmDangerous) {
        this.confirmDangerous = confirmDangerous;
    }

    public List<String> getDangerousPatterns() {
        return dangerousPatterns;
    }

    public void setDangerousPatterns(List<String> dangerousPatterns) {
        this.dangerousPatterns = dangerousPatterns;
    }
}
