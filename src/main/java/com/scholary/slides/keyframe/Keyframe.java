package com.scholary.slides.keyframe;

import com.scholary.slides.frame.Frame;

/** A consolidated slide: its timestamp and its materialised frame. */
public record Keyframe(double timestamp, Frame frame) {}
