package com.fillline.scheduler.engine;

import lombok.Value;

@Value
public class ProgressEvent {
    String strategy;
    int placed;
    int total;
}
