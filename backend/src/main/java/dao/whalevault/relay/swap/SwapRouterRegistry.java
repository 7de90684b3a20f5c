package dao.whalevault.relay.swap;

import dao.whalevault.relay.config.SwapProperties;
import dao.whalevault.relay.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Slf4j
@Component
public class SwapRouterRegistry {

    private final Map<String, SwapRouter> routers = new TreeMap<>();
    private final String defaultProvider;

    public SwapRouterRegistry(List<SwapRouter> routers, SwapProperties props) {
        for (SwapRouter router : routers) {
            this.routers.put(router.providerId(), router);
        }
        this.defaultProvider = props.getDefaultProvider().toLowerCase(Locale.ROOT);
        if (!this.routers.containsKey(defaultProvider)) {
            throw new IllegalStateException("Default swap provider '" + defaultProvider + "' is not registered");
        }
        log.info("Swap routers: {} (default={})", this.routers.keySet(), defaultProvider);
    }

    /**
     * @param provider provider id, or null/blank for the configured default
     */
    public SwapRouter resolve(String provider) {
        String id = provider == null || provider.isBlank() ? defaultProvider : provider.toLowerCase(Locale.ROOT);
        SwapRouter router = routers.get(id);
        if (router == null) {
            throw new ValidationException("Unknown swap provider: " + provider + " (available: " + routers.keySet() + ")");
        }
        return router;
    }

    public Set<String> providers() {
        return routers.keySet();
    }
}
