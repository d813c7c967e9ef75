package com.mimecast.mailroom.config;

import java.util.Map;

/**
 * Basic configuration container.
 *
 * <p>Generic typed wrapper over a configuration sub-map.
 */
public class BasicConfig extends ConfigFoundation {

    /**
     * Constructs a new BasicConfig instance.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map<String, Object> map) {
        super(map);
    }
}
