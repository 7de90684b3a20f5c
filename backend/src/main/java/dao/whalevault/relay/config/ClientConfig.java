package dao.whalevault.relay.config;

import dao.whalevault.relay.swap.RetryPolicy;
import dao.whalevault.relay.util.Sleeper;
import org.p2p.solanaj.rpc.RpcClient;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ClientConfig {

    @Bean
    public RpcClient solanaRpcClient(SolanaProperties props) {
        return new RpcClient(props.getRpcUrl(), (int) props.getReadTimeoutMs(),
                (int) props.getConnectTimeoutMs(), (int) props.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate aggregatorRestTemplate(RestTemplateBuilder builder, SwapProperties props) {
        return builder
                .setConnectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(props.getReadTimeoutMs()))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public RetryPolicy aggregatorRetryPolicy(SwapProperties props, Sleeper sleeper) {
        SwapProperties.Retry retry = props.getRetry();
        return new RetryPolicy(retry.getMaxRetries(), Duration.ofMillis(retry.getBaseDelayMs()), retry.getMultiplier(), sleeper);
    }
}
