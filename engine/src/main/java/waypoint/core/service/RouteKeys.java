package waypoint.core.service;

/**
 * Cache key and tag naming for routes.
 */
public final class RouteKeys {

    public static final String KEY_PREFIX = "page:";
    public static final String ROUTE_TAG_PREFIX = "route:";
    public static final String PAGE_TAG_PREFIX = "page:";
    public static final String CONTENT_TAG_PREFIX = "content:";

    private RouteKeys() {}

    public static String cacheKey(String route) {
        return KEY_PREFIX + route;
    }

    public static String routeTag(String route) {
        return ROUTE_TAG_PREFIX + route;
    }
}
