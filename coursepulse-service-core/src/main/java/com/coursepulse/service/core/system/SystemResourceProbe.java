package com.coursepulse.service.core.system;

@FunctionalInterface
public interface SystemResourceProbe {

    SystemResources snapshot();
}
