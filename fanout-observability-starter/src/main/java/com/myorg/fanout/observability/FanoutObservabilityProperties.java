package com.myorg.fanout.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "fanout.observability")
public class FanoutObservabilityProperties {
    private boolean enabled = true;

    private boolean mdcEnabled = true;
    private boolean metricsEnabled = true;

    // Tag an toàn cardinality: channel là tập hữu hạn (post, follow...), kênh riêng mem-* bị gộp
    private boolean tagChannel = true;
    private boolean tagOutcome = true;
}
