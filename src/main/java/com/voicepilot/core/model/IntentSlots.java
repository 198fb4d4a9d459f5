package com.voicepilot.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed parameters of an {@link Intent}. There is exactly one slot shape per
 * {@link IntentName}; the raw string-keyed map only exists at the payload boundary
 * (see {@link com.voicepilot.core.schema.SlotCodec}).
 */
public interface IntentSlots extends Serializable {

    /** The intent this slot shape belongs to. */
    IntentName intent();

    /** Raw payload form. Null fields are omitted. */
    Map<String, Object> toMap();

    /**
     * @param setting volume, brightness, mute or screenshot
     * @param value   target level, null when the setting takes none
     */
    record SystemSetting(String setting, Integer value) implements IntentSlots {
        @Override
        public IntentName intent() {
            return IntentName.SYSTEM_SETTING;
        }

        @Override
        public Map<String, Object> toMap() {
            var map = new LinkedHashMap<String, Object>();
            putIfPresent(map, "setting", setting);
            putIfPresent(map, "value", value);
            return map;
        }
    }

    /**
     * @param action play, pause, next or previous
     * @param query  what to play (optional)
     */
    record PlayMusic(String action, String query) implements IntentSlots {
        @Override
        public IntentName intent() {
            return IntentName.PLAY_MUSIC;
        }

        @Override
        public Map<String, Object> toMap() {
            var map = new LinkedHashMap<String, Object>();
            putIfPresent(map, "action", action);
            putIfPresent(map, "query", query);
            return map;
        }
    }

    record WebSearch(String query) implements IntentSlots {
        @Override
        public IntentName intent() {
            return IntentName.WEB_SEARCH;
        }

        @Override
        public Map<String, Object> toMap() {
            var map = new LinkedHashMap<String, Object>();
            putIfPresent(map, "query", query);
            return map;
        }
    }

    record WriteNote(String title, String body) implements IntentSlots {
        @Override
        public IntentName intent() {
            return IntentName.WRITE_NOTE;
        }

        @Override
        public Map<String, Object> toMap() {
            var map = new LinkedHashMap<String, Object>();
            putIfPresent(map, "title", title);
            putIfPresent(map, "body", body);
            return map;
        }
    }

    /**
     * @param app    application name
     * @param action open or quit
     * @param url    page to open in the app (optional)
     */
    record ControlApp(String app, String action, String url) implements IntentSlots {
        @Override
        public IntentName intent() {
            return IntentName.CONTROL_APP;
        }

        @Override
        public Map<String, Object> toMap() {
            var map = new LinkedHashMap<String, Object>();
            putIfPresent(map, "app", app);
            putIfPresent(map, "action", action);
            putIfPresent(map, "url", url);
            return map;
        }
    }

    record Clarify() implements IntentSlots {
        @Override
        public IntentName intent() {
            return IntentName.CLARIFY;
        }

        @Override
        public Map<String, Object> toMap() {
            return new LinkedHashMap<>();
        }
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
