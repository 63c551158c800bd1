package eventsource.bus;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A handler registered on an {@link EventBus} for the topics matching a pattern.
 *
 * <p>The topic of an event is its {@code eventType}. The pattern is a regular
 * expression matched from the start of the topic; {@code "*"} matches every topic.
 * Subscriptions are immutable.
 */
public final class Subscription {
  public static final String ALL_TOPICS = "*";

  private final String id;
  private final String topicPattern;
  private final Pattern pattern;
  private final String handlerName;
  private final EventHandler handler;
  private final int priority;
  private final long order;

  Subscription(String id, String topicPattern, String handlerName, EventHandler handler,
      int priority, long order) {
    this.id = Objects.requireNonNull(id, "id");
    this.topicPattern = Objects.requireNonNull(topicPattern, "topicPattern");
    this.handlerName = Objects.requireNonNull(handlerName, "handlerName");
    this.handler = Objects.requireNonNull(handler, "handler");
    if (handlerName.isEmpty()) {
      throw new IllegalArgumentException("handlerName cannot be empty");
    }
    this.pattern = ALL_TOPICS.equals(topicPattern) ? null : Pattern.compile(topicPattern);
    this.priority = priority;
    this.order = order;
  }

  public String id() {
    return id;
  }

  public String topicPattern() {
    return topicPattern;
  }

  public String handlerName() {
    return handlerName;
  }

  public EventHandler handler() {
    return handler;
  }

  /**
   * Higher values run first.
   */
  public int priority() {
    return priority;
  }

  /**
   * Registration order, used to break priority ties.
   */
  public long order() {
    return order;
  }

  public boolean matches(String topic) {
    return pattern == null || pattern.matcher(topic).lookingAt();
  }

  @Override
  public String toString() {
    return "Subscription{id=" + id + ", topicPattern=" + topicPattern
        + ", handlerName=" + handlerName + ", priority=" + priority + '}';
  }
}
