package waypoint.core.model.navigation;

import java.util.Objects;

import waypoint.core.model.cache.ContentKind;
import waypoint.core.model.cache.PageKind;

/**
 * Classification supplied when caching data for a route.
 *
 * @param route the logical page identifier
 * @param pageKind page classification
 * @param contentKind content classification
 * @param hasUnsavedChanges whether the page holds unsaved user input
 */
public record PageDescriptor(String route, PageKind pageKind, ContentKind contentKind, boolean hasUnsavedChanges) {

    public PageDescriptor {
        Objects.requireNonNull(route, "route cannot be null");
        pageKind = pageKind == null ? PageKind.OTHER : pageKind;
        contentKind = contentKind == null ? ContentKind.GENERIC : contentKind;
    }

    public static PageDescriptor of(String route, PageKind pageKind, ContentKind contentKind) {
        return new PageDescriptor(route, pageKind, contentKind, false);
    }

    public PageDescriptor withUnsavedChanges(boolean hasUnsavedChanges) {
        return new PageDescriptor(route, pageKind, contentKind, hasUnsavedChanges);
    }
}
