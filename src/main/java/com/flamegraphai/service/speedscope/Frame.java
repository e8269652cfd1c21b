package com.flamegraphai.service.speedscope;

import lombok.Value;

/**
 * Entry of the shared frame table, addressed by its position.
 */
@Value
public class Frame {
    int index;
    String name;
    String file;
}
