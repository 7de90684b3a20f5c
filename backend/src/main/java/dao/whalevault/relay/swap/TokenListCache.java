package dao.whalevault.relay.swap;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import dao.whalevault.relay.model.TokenInfo;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Token list kept for a TTL and reloaded lazily on the first read after it expires.
 * A failed load propagates the error and is retried on the next read.
 */
public class TokenListCache {

    private static final String KEY = "tokens";

    private final LoadingCache<String, List<TokenInfo>> cache;

    public TokenListCache(Clock clock, Duration ttl, Supplier<List<TokenInfo>> loader) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build(key -> List.copyOf(loader.get()));
    }

    public List<TokenInfo> get() {
        return cache.get(KEY);
    }
}
