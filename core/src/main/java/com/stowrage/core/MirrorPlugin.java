package com.stowrage.core;

public interface MirrorPlugin {
    Mirror open(StowrageConfig config);
    void cleanUp();
}
