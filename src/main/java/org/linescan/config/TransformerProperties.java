package org.linescan.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import org.yaml.snakeyaml.LoaderOptions;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the YAML transformer
 */
@Validated
@ConfigurationProperties(prefix = "transformer.yaml")
public class TransformerProperties {

    /** File extensions, without the dot, routed to the YAML transformer. */
    @NotEmpty
    private List<String> extensions = new ArrayList<>(List.of("yaml", "yml"));

    /** Charset used when a file has no BOM and is not valid UTF-8. */
    @NotBlank
    private String fallbackEncoding = "ISO-8859-1";

    private boolean allowDuplicateKeys = true;

    @Min(1)
    private int maxAliasesForCollections = 50;

    @Min(1)
    private int nestingDepthLimit = 50;

    @Min(1)
    private int codePointLimit = 3 * 1024 * 1024;

    /**
     * Builds fresh SnakeYAML loader options from these settings. Errors raised while constructing
     * values are wrapped into YAML exceptions so a single failure type reaches the caller.
     */
    public LoaderOptions toLoaderOptions() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(allowDuplicateKeys);
        options.setMaxAliasesForCollections(maxAliasesForCollections);
        options.setNestingDepthLimit(nestingDepthLimit);
        options.setCodePointLimit(codePointLimit);
        options.setWrappedToRootException(true);
        return options;
    }

    public Charset fallbackCharset() {
        return Charset.forName(fallbackEncoding);
    }

    // Getters and Setters
    public List<String> getExtensions() { return extensions; }
    public void setExtensions(List<String> extensions) { this.extensions = extensions; }
    public String getFallbackEncoding() { return fallbackEncoding; }
    public void setFallbackEncoding(String fallbackEncoding) { this.fallbackEncoding = fallbackEncoding; }
    public boolean isAllowDuplicateKeys() { return allowDuplicateKeys; }
    public void setAllowDuplicateKeys(boolean allowDuplicateKeys) { this.allowDuplicateKeys = allowDuplicateKeys; }
    public int getMaxAliasesForCollections() { return maxAliasesForCollections; }
    public void setMaxAliasesForCollections(int maxAliasesForCollections) { this.maxAliasesForCollections = maxAliasesForCollections; }
    public int getNestingDepthLimit() { return nestingDepthLimit; }
    public void setNestingDepthLimit(int nestingDepthLimit) { this.nestingDepthLimit = nestingDepthLimit; }
    public int getCodePointLimit() { return codePointLimit; }
    public void setCodePointLimit(int codePointLimit) { this.codePointLimit = codePointLimit; }
}
