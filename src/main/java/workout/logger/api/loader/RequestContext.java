package workout.logger.api.loader;

import workout.logger.api.security.Principal;

/**
 * Per-request state passed explicitly to services: the caller and the request's loaders.
 * Closing the context ends the request; anything still pending on its loaders is cancelled.
 */
public class RequestContext implements AutoCloseable {
    private final Principal principal;
    private final RequestLoaders loaders;

    public RequestContext(Principal principal, RequestLoaders loaders) {
        this.principal = principal;
        this.loaders = loaders;
    }

    public Principal getPrincipal() {
        return principal;
    }

    public long getUserId() {
        return principal.getId();
    }

    public RequestLoaders getLoaders() {
        return loaders;
    }

    @Override
    public void close() {
        loaders.cancelAll();
    }
}
