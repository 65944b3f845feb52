package org.geoserve.server.spring.config.model;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.geoserve.server.util.HttpUtil;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@Data
@NoArgsConstructor
public class RemoteDatabaseProperties {

    public static final String LICENSE_KEY_MACRO = "license_key";

    public static final String DEFAULT_URL = "https://download.maxmind.com/app/geoip_download"
            + "?edition_id=GeoLite2-City&license_key={{license_key}}&suffix=tar.gz";

    /**
     * Download URL, may contain {{license_key}} macro.
     */
    private String url;

    private String licenseKey;

    @Positive
    private long timeoutMs;

    @Positive
    private long connectTimeoutMs;

    @Positive
    private int maxRedirects;

    @Positive
    private long checkIntervalMs;

    @Positive
    private long refreshIntervalMs;

    @NotEmpty
    private List<String> databaseFileNames;

    /**
     * Returns URL to poll or null if remote source is not configured.
     * <p>
     * A license key alone enables the default MaxMind GeoLite2-City download.
     */
    public String resolveDownloadUrl() {
        final String template = StringUtils.isNotBlank(url)
                ? url.trim()
                : StringUtils.isNotBlank(licenseKey) ? DEFAULT_URL : null;

        return template != null
                ? HttpUtil.expandMacro(template, LICENSE_KEY_MACRO, StringUtils.trimToEmpty(licenseKey))
                : null;
    }
}
