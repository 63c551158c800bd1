package eventsource.upcast;

import java.util.Map;

/**
 * Pure migration of an event payload from one schema version to the next.
 *
 * <p>The registry passes a fresh mutable copy of the payload, so an upcaster may
 * modify and return its argument.
 *
 * @see UpcasterRegistry#register(String, int, Upcaster)
 */
@FunctionalInterface
public interface Upcaster {

    Map<String, Object> upcast(Map<String, Object> payload);
}
