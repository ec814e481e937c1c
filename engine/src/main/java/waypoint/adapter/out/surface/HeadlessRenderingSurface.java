package waypoint.adapter.out.surface;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import waypoint.core.model.state.ScrollPosition;
import waypoint.core.port.out.RenderingSurface;

/**
 * Rendering surface for environments without a display.
 *
 * <p>Reads return empty state and writes are ignored. Next-frame tasks run at once.
 */
public class HeadlessRenderingSurface implements RenderingSurface {

    @Override
    public ScrollPosition readScrollPosition() {
        return ScrollPosition.ORIGIN;
    }

    @Override
    public Map<String, Object> readFilters(List<String> selectors) {
        return Map.of();
    }

    @Override
    public List<String> readExpandedSections(List<String> selectors) {
        return List.of();
    }

    @Override
    public Optional<String> readSearchTerm(List<String> selectors) {
        return Optional.empty();
    }

    @Override
    public Map<String, Object> readFormData(List<String> selectors) {
        return Map.of();
    }

    @Override
    public void applyFilters(Map<String, Object> filters) {}

    @Override
    public void applyExpandedSections(List<String> sectionIds) {}

    @Override
    public void applyFormData(Map<String, Object> formData) {}

    @Override
    public void applySearchTerm(String searchTerm) {}

    @Override
    public void applyScrollPosition(ScrollPosition position) {}

    @Override
    public void onNextFrame(Runnable task) {
        task.run();
    }
}
