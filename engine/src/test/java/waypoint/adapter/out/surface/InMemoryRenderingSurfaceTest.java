package waypoint.adapter.out.surface;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import waypoint.adapter.out.surface.InMemoryRenderingSurface.Change;
import waypoint.core.model.state.ScrollPosition;

@DisplayName("InMemoryRenderingSurface")
class InMemoryRenderingSurfaceTest {

    private InMemoryRenderingSurface surface;
    private List<Change> changes;

    @BeforeEach
    void setUp() {
        changes = new ArrayList<>();
        surface = new InMemoryRenderingSurface()
                .defineFilter("status", "[data-filter]", "open")
                .defineFilter("internal", ".hidden-filter", "x")
                .defineSection("faq-1", "details", false)
                .defineSearchInput("q", "input[type=search]", "")
                .defineForm("profile", "form[data-persist]", Map.of("name", "", "email", ""));
        surface.addChangeListener(changes::add);
    }

    @Nested
    @DisplayName("Reading")
    class ReadTests {

        @Test
        @DisplayName("Should read only controls whose selector is requested")
        void shouldMatchSelectors() {
            assertEquals(Map.of("status", "open"), surface.readFilters(List.of("[data-filter]")));
            assertEquals(List.of(), surface.readExpandedSections(List.of("details")));
            assertEquals(Optional.of(""), surface.readSearchTerm(List.of("input[type=search]")));
            assertTrue(surface.readSearchTerm(List.of(".other")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Applying")
    class ApplyTests {

        @Test
        @DisplayName("Should update known controls and fire change events")
        void shouldApplyAndFire() {
            surface.applyFilters(Map.of("status", "closed", "unknown", "ignored"));
            surface.applyExpandedSections(List.of("faq-1", "faq-9"));
            surface.applySearchTerm("refunds");

            assertEquals(
                    List.of(
                            new Change("filter", "status", "closed"),
                            new Change("section", "faq-1", true),
                            new Change("search", "q", "refunds")),
                    changes);
            assertEquals(Optional.of("closed"), surface.valueOf("status"));
            assertEquals(List.of("faq-1"), surface.readExpandedSections(List.of("details")));
        }

        @Test
        @DisplayName("Should only update fields the form already has")
        void shouldMergeFormFields() {
            surface.applyFormData(Map.of("profile", Map.of("name", "Ada", "admin", true)));

            assertEquals(
                    Map.of("profile", Map.of("name", "Ada", "email", "")),
                    surface.readFormData(List.of("form[data-persist]")));
        }

        @Test
        @DisplayName("Should keep notifying when a listener fails")
        void shouldIsolateListenerFailures() {
            var broken = new InMemoryRenderingSurface().defineFilter("status", "[data-filter]", "open");
            List<Change> received = new ArrayList<>();
            broken.addChangeListener(change -> {
                throw new IllegalStateException("listener broke");
            });
            broken.addChangeListener(received::add);

            broken.applyFilters(Map.of("status", "closed"));

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("Frames")
    class FrameTests {

        @Test
        @DisplayName("Should defer next-frame tasks until flushed")
        void shouldDeferTasks() {
            var target = new ScrollPosition(0, 420);
            surface.onNextFrame(() -> surface.applyScrollPosition(target));

            assertEquals(1, surface.pendingFrameTasks());
            assertEquals(ScrollPosition.ORIGIN, surface.readScrollPosition());

            assertEquals(1, surface.flushFrame());
            assertEquals(target, surface.readScrollPosition());
            assertEquals(0, surface.pendingFrameTasks());
        }
    }
}
