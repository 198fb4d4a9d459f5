package com.voicepilot.core.rules;

import com.voicepilot.core.model.IntentName;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "voicepilot.rules")
public class RuleProperties {

    /** Evaluated top to bottom; the first intent with a matching pattern wins. */
    private List<IntentRule> intentRules = defaultIntentRules();

    private int minFragmentLength = 2;
    private int minClauseLength = 4;

    public List<IntentRule> getIntentRules() {
        return intentRules;
    }

    public void setIntentRules(List<IntentRule> intentRules) {
        this.intentRules = intentRules;
    }

    public int getMinFragmentLength() {
        return minFragmentLength;
    }

    public void setMinFragmentLength(int minFragmentLength) {
        this.minFragmentLength = minFragmentLength;
    }

    public int getMinClauseLength() {
        return minClauseLength;
    }

    public void setMinClauseLength(int minClauseLength) {
        this.minClauseLength = minClauseLength;
    }

    static List<IntentRule> defaultIntentRules() {
        var rules = new ArrayList<IntentRule>();
        rules.add(new IntentRule(IntentName.SYSTEM_SETTING, List.of(
                "音量|声音|volume",
                "亮度|brightness",
                "截图|screenshot",
                "静音|mute")));
        rules.add(new IntentRule(IntentName.PLAY_MUSIC, List.of(
                "播放|play",
                "暂停|pause",
                "音乐|歌曲|music|song",
                "下一首|上一首|next|previous")));
        rules.add(new IntentRule(IntentName.WEB_SEARCH, List.of(
                "搜索|查找|search|google|百度",
                "找一下|查一下")));
        rules.add(new IntentRule(IntentName.WRITE_NOTE, List.of(
                "记录|笔记|备忘|note|memo",
                "写下|记下")));
        rules.add(new IntentRule(IntentName.CONTROL_APP, List.of(
                "打开.*应用|打开.*app|open.*app",
                "打开|启动|关闭|退出|\\bopen\\b|launch|quit",
                "safari|chrome|微信|wechat")));
        return rules;
    }
}
