package com.tokendraw.engine.event;

@FunctionalInterface
public interface DrawEventListener {

  void onEvent(DrawEvent event);
}
