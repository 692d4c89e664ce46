package com.vidnyan.vbuilder;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for design sessions.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "vbuilder")
public class VbuilderProperties {

    /**
     * Top module name of a new session.
     */
    private String defaultTopName = "top";

    /**
     * On save, rename the top module after the file's base name when that is a legal identifier.
     */
    private boolean deriveTopNameFromFile = true;

    /**
     * On load, re-parse readable module sources instead of trusting the saved descriptors.
     */
    private boolean reparseSourcesOnLoad = false;
}
