package com.zzf.selfpatch.core.restart;

public enum RestartStatus {
    /** Another restart is already scheduled; nothing new was started. */
    ALREADY_PENDING,
    LAUNCHED,
    /** The relaunch command could not be started; the process keeps running. */
    FAILED
}
