package dao.whalevault.relay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "proof-job")
@Data
public class ProofJobProperties {

    /**
     * Terminal jobs older than this are removed by the sweep.
     * Default: 60 minutes
     */
    private long retentionMinutes = 60;

    /**
     * How often the sweep runs (in milliseconds)
     * Default: 300000ms (5 minutes)
     */
    private long sweepIntervalMs = 300_000;

    /**
     * Pause between the progress stages reported to pollers.
     */
    private long stageDelayMs = 300;

    private int workerThreads = 4;

    /**
     * Hint returned on submission, in seconds.
     */
    private int estimatedSeconds = 5;
}
