package com.rollupquery.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DataSizeUnit;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.util.unit.DataSize;
import org.springframework.util.unit.DataUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@ConfigurationProperties("rollup.cache")
@Data
@Validated
public class ResultCacheProperties {

    /**
     * Upper bound on the estimated size of all cached results.
     */
    @NotNull
    @DataSizeUnit(DataUnit.MEGABYTES)
    DataSize maxSize = DataSize.ofMegabytes(50);

    /**
     * Age after which a cached result is treated as stale.
     */
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    Duration ttl = Duration.ofMinutes(30);

    @Min(1)
    int maxEntries = 500;

    /**
     * How often expired entries are swept out, in addition to lazy expiry on read.
     */
    @NotNull
    Duration purgeInterval = Duration.ofMinutes(1);
}
