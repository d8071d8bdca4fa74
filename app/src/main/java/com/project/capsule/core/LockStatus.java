package com.project.capsule.core;

public enum LockStatus {
    LOCKED,
    UNLOCKABLE
}
