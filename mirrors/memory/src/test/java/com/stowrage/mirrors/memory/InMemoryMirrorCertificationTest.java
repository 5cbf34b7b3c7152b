package com.stowrage.mirrors.memory;

import com.stowrage.mirrors.certification.MirrorCertification;

public class InMemoryMirrorCertificationTest extends MirrorCertification {

    @Override
    public void init() {
        mirror = new InMemoryMirror("test", new InMemoryTable());
    }
}
