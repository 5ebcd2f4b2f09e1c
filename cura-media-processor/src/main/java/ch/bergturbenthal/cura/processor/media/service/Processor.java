package ch.bergturbenthal.cura.processor.media.service;

public interface Processor {
  boolean run();
}
