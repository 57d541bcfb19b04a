package com.tokendraw.engine.support;

import com.tokendraw.engine.event.DrawEvent;
import com.tokendraw.engine.event.DrawEventListener;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Collects published events in order. */
public class RecordingListener implements DrawEventListener {

  private final List<DrawEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void onEvent(DrawEvent event) {
    events.add(event);
  }

  public List<DrawEvent> events() {
    return List.copyOf(events);
  }

  public List<DrawEvent> named(String name) {
    return events.stream().filter(event -> event.name().equals(name)).toList();
  }

  public List<String> names() {
    return events.stream().map(DrawEvent::name).toList();
  }
}
