package com.voicepilot.core.rules;

import com.voicepilot.core.model.IntentName;
import com.voicepilot.core.model.IntentSlots;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-driven slot extraction for rule-matched utterances.
 */
final class SlotExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern PERCENT = Pattern.compile("(\\d+)\\s*%", FLAGS);
    private static final Pattern LEVEL_AFTER_KEYWORD =
            Pattern.compile("(?:音量|声音|volume|亮度|brightness)\\D*?(\\d+)", FLAGS);
    private static final Pattern BRIGHTNESS = Pattern.compile("亮度|brightness", FLAGS);
    private static final Pattern MUTE = Pattern.compile("静音|mute", FLAGS);
    private static final Pattern SCREENSHOT = Pattern.compile("截图|screenshot", FLAGS);

    private static final Pattern PAUSE = Pattern.compile("暂停|pause", FLAGS);
    private static final Pattern NEXT = Pattern.compile("下一首|next", FLAGS);
    private static final Pattern PREVIOUS = Pattern.compile("上一首|previous", FLAGS);
    private static final Pattern MUSIC_QUERY = Pattern.compile("(?:播放|play)\\s*(.+)", FLAGS);
    private static final Pattern GENERIC_MUSIC = Pattern.compile("(?:一首|一些)?(?:音乐|歌曲|歌|music|songs?)", FLAGS);

    private static final Pattern SEARCH_QUERY =
            Pattern.compile("(?:搜索|查找|查一下|找一下|search(?:\\s+for)?)\\s*(.+)", FLAGS);

    private static final Pattern NOTE_BODY = Pattern.compile("(?:记录|笔记|note)\\s*[:：]?\\s*(.+)", FLAGS);
    private static final int NOTE_TITLE_LENGTH = 20;
    private static final String DEFAULT_NOTE_TITLE = "Quick Note";

    private static final Pattern APP_AFTER_OPEN = Pattern.compile("(?:打开|启动|open|launch)\\s*([\\w.]+)", FLAGS);
    private static final Pattern APP_AFTER_QUIT = Pattern.compile("(?:关闭|退出|quit|close)\\s*([\\w.]+)", FLAGS);
    private static final Pattern QUIT = Pattern.compile("关闭|退出|quit|close", FLAGS);
    private static final Pattern KNOWN_APP = Pattern.compile("safari|chrome|微信|wechat", FLAGS);
    private static final Pattern APP_SUFFIX = Pattern.compile("(?:应用|app)$", FLAGS);

    private SlotExtractor() {}

    static IntentSlots extract(IntentName intent, String text) {
        return switch (intent) {
            case SYSTEM_SETTING -> systemSetting(text);
            case PLAY_MUSIC -> playMusic(text);
            case WEB_SEARCH -> webSearch(text);
            case WRITE_NOTE -> writeNote(text);
            case CONTROL_APP -> controlApp(text);
            case CLARIFY -> new IntentSlots.Clarify();
        };
    }

    private static IntentSlots systemSetting(String text) {
        if (SCREENSHOT.matcher(text).find()) {
            return new IntentSlots.SystemSetting("screenshot", null);
        }
        if (MUTE.matcher(text).find()) {
            return new IntentSlots.SystemSetting("mute", null);
        }
        String setting = BRIGHTNESS.matcher(text).find() ? "brightness" : "volume";
        return new IntentSlots.SystemSetting(setting, level(text));
    }

    private static Integer level(String text) {
        Matcher percent = PERCENT.matcher(text);
        if (percent.find()) {
            return parseLevel(percent.group(1));
        }
        Matcher afterKeyword = LEVEL_AFTER_KEYWORD.matcher(text);
        if (afterKeyword.find()) {
            return parseLevel(afterKeyword.group(1));
        }
        return null;
    }

    /** Digit runs that do not fit an int carry no usable level. */
    private static Integer parseLevel(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static IntentSlots playMusic(String text) {
        String action;
        if (PAUSE.matcher(text).find()) {
            action = "pause";
        } else if (PREVIOUS.matcher(text).find()) {
            action = "previous";
        } else if (NEXT.matcher(text).find()) {
            action = "next";
        } else {
            action = "play";
        }
        String query = null;
        if (action.equals("play")) {
            Matcher m = MUSIC_QUERY.matcher(text);
            if (m.find()) {
                String candidate = m.group(1).trim();
                if (!candidate.isEmpty() && !GENERIC_MUSIC.matcher(candidate).matches()) {
                    query = candidate;
                }
            }
        }
        return new IntentSlots.PlayMusic(action, query);
    }

    private static IntentSlots webSearch(String text) {
        Matcher m = SEARCH_QUERY.matcher(text);
        if (m.find()) {
            return new IntentSlots.WebSearch(m.group(1).trim());
        }
        return new IntentSlots.WebSearch(text.trim());
    }

    private static IntentSlots writeNote(String text) {
        Matcher m = NOTE_BODY.matcher(text);
        if (m.find()) {
            String content = m.group(1).trim();
            return new IntentSlots.WriteNote(prefix(content, NOTE_TITLE_LENGTH), content);
        }
        return new IntentSlots.WriteNote(DEFAULT_NOTE_TITLE, text.trim());
    }

    private static IntentSlots controlApp(String text) {
        boolean quit = QUIT.matcher(text).find();
        Matcher named = (quit ? APP_AFTER_QUIT : APP_AFTER_OPEN).matcher(text);
        String app = null;
        if (named.find()) {
            app = APP_SUFFIX.matcher(named.group(1)).replaceFirst("");
        }
        if (app == null || app.isEmpty()) {
            Matcher known = KNOWN_APP.matcher(text);
            app = known.find() ? known.group() : null;
        }
        return new IntentSlots.ControlApp(app, quit ? "quit" : "open", null);
    }

    private static String prefix(String s, int codePoints) {
        if (s.codePointCount(0, s.length()) <= codePoints) {
            return s;
        }
        return s.substring(0, s.offsetByCodePoints(0, codePoints));
    }
}
