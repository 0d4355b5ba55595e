package com.lelantos.tracker;

import com.lelantos.common.RequestPacer;

import java.util.concurrent.locks.ReentrantLock;

/**
 * The single request queue of one API key: a fair lock plus the pacer it guards. Every session opened for the key
 * shares the same lane, so replacing a session never lets two requests run side by side.
 */
public class RequestLane {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final RequestPacer pacer;

    public RequestLane(RequestPacer pacer) {
        this.pacer = pacer;
    }

    ReentrantLock lock() {
        return lock;
    }

    public RequestPacer getPacer() {
        return pacer;
    }
}
