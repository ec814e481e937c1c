package waypoint.adapter.out.surface;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.jboss.logging.Logger;

import waypoint.core.model.state.ScrollPosition;
import waypoint.core.port.out.RenderingSurface;

/**
 * Rendering surface backed by an in-memory model of the page.
 *
 * <p>Controls are defined together with the selectors that match them. Every
 * applied value emits a {@link Change} to registered listeners, the way a
 * UI toolkit fires change events. Next-frame tasks are queued until
 * {@link #flushFrame()} is called.
 */
public class InMemoryRenderingSurface implements RenderingSurface {

    private static final Logger LOG = Logger.getLogger(InMemoryRenderingSurface.class);

    /**
     * A value written to the page.
     *
     * @param kind the kind of control: filter, section, form, search or scroll
     * @param target name or identifier of the control
     * @param value the new value
     */
    public record Change(String kind, String target, Object value) {}

    private final Map<String, Control> filters = new LinkedHashMap<>();
    private final Map<String, Control> sections = new LinkedHashMap<>();
    private final Map<String, Control> searchInputs = new LinkedHashMap<>();
    private final Map<String, Control> forms = new LinkedHashMap<>();
    private final Queue<Runnable> frameQueue = new ArrayDeque<>();
    private final List<Consumer<Change>> listeners = new CopyOnWriteArrayList<>();
    private ScrollPosition scrollPosition = ScrollPosition.ORIGIN;

    public synchronized InMemoryRenderingSurface defineFilter(String name, String selector, Object value) {
        filters.put(name, new Control(selector, value));
        return this;
    }

    public synchronized InMemoryRenderingSurface defineSection(String id, String selector, boolean expanded) {
        sections.put(id, new Control(selector, expanded));
        return this;
    }

    public synchronized InMemoryRenderingSurface defineSearchInput(String name, String selector, String value) {
        searchInputs.put(name, new Control(selector, value));
        return this;
    }

    public synchronized InMemoryRenderingSurface defineForm(String formId, String selector, Map<String, Object> fields) {
        forms.put(formId, new Control(selector, new LinkedHashMap<>(fields)));
        return this;
    }

    public synchronized void scrollTo(ScrollPosition position) {
        this.scrollPosition = position;
    }

    public void addChangeListener(Consumer<Change> listener) {
        listeners.add(listener);
    }

    /**
     * Current value of a control, across all control kinds.
     */
    public synchronized Optional<Object> valueOf(String name) {
        for (Map<String, Control> controls : List.of(filters, sections, searchInputs, forms)) {
            Control control = controls.get(name);
            if (control != null) {
                return Optional.ofNullable(control.value);
            }
        }
        return Optional.empty();
    }

    /**
     * Runs the tasks queued for the next frame.
     *
     * @return number of tasks run
     */
    public int flushFrame() {
        List<Runnable> tasks;
        synchronized (this) {
            tasks = new ArrayList<>(frameQueue);
            frameQueue.clear();
        }
        tasks.forEach(Runnable::run);
        return tasks.size();
    }

    public synchronized int pendingFrameTasks() {
        return frameQueue.size();
    }

    @Override
    public synchronized ScrollPosition readScrollPosition() {
        return scrollPosition;
    }

    @Override
    public synchronized Map<String, Object> readFilters(List<String> selectors) {
        Map<String, Object> values = new LinkedHashMap<>();
        matching(filters, selectors).forEach((name, control) -> values.put(name, control.value));
        return values;
    }

    @Override
    public synchronized List<String> readExpandedSections(List<String> selectors) {
        List<String> expanded = new ArrayList<>();
        matching(sections, selectors).forEach((id, control) -> {
            if (Boolean.TRUE.equals(control.value)) {
                expanded.add(id);
            }
        });
        return expanded;
    }

    @Override
    public synchronized Optional<String> readSearchTerm(List<String> selectors) {
        return matching(searchInputs, selectors).values().stream()
                .findFirst()
                .map(control -> control.value == null ? "" : control.value.toString());
    }

    @Override
    public synchronized Map<String, Object> readFormData(List<String> selectors) {
        Map<String, Object> values = new LinkedHashMap<>();
        matching(forms, selectors).forEach((formId, control) -> values.put(formId, control.value));
        return values;
    }

    @Override
    public void applyFilters(Map<String, Object> values) {
        values.forEach((name, value) -> {
            if (update(filters, name, value)) {
                fire(new Change("filter", name, value));
            }
        });
    }

    @Override
    public void applyExpandedSections(List<String> sectionIds) {
        for (String id : sectionIds) {
            if (update(sections, id, true)) {
                fire(new Change("section", id, true));
            }
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public void applyFormData(Map<String, Object> formData) {
        formData.forEach((formId, fields) -> {
            if (!(fields instanceof Map<?, ?> fieldMap)) {
                LOG.debugf("Ignoring form %s with non-map data", formId);
                return;
            }
            Map<String, Object> current;
            synchronized (this) {
                Control control = forms.get(formId);
                if (control == null) {
                    return;
                }
                current = new LinkedHashMap<>((Map<String, Object>) control.value);
                fieldMap.forEach((field, value) -> {
                    if (current.containsKey(String.valueOf(field))) {
                        current.put(String.valueOf(field), value);
                    }
                });
                control.value = current;
            }
            fire(new Change("form", formId, current));
        });
    }

    @Override
    public void applySearchTerm(String searchTerm) {
        String name;
        synchronized (this) {
            Optional<Map.Entry<String, Control>> first = searchInputs.entrySet().stream().findFirst();
            if (first.isEmpty()) {
                return;
            }
            name = first.get().getKey();
            first.get().getValue().value = searchTerm;
        }
        fire(new Change("search", name, searchTerm));
    }

    @Override
    public void applyScrollPosition(ScrollPosition position) {
        synchronized (this) {
            this.scrollPosition = position;
        }
        fire(new Change("scroll", "window", position));
    }

    @Override
    public synchronized void onNextFrame(Runnable task) {
        frameQueue.add(task);
    }

    private static Map<String, Control> matching(Map<String, Control> controls, Collection<String> selectors) {
        Set<String> wanted = Set.copyOf(selectors);
        Map<String, Control> result = new LinkedHashMap<>();
        controls.forEach((name, control) -> {
            if (wanted.contains(control.selector)) {
                result.put(name, control);
            }
        });
        return result;
    }

    private synchronized boolean update(Map<String, Control> controls, String name, Object value) {
        Control control = controls.get(name);
        if (control == null) {
            return false;
        }
        control.value = value;
        return true;
    }

    private void fire(Change change) {
        for (Consumer<Change> listener : listeners) {
            try {
                listener.accept(change);
            } catch (RuntimeException e) {
                LOG.warnf("Change listener failed for %s %s: %s", change.kind(), change.target(), e.getMessage());
            }
        }
    }

    private static final class Control {
        private final String selector;
        private Object value;

        private Control(String selector, Object value) {
            this.selector = selector;
            this.value = value;
        }
    }
}
