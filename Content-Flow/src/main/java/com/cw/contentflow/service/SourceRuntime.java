package com.cw.contentflow.service;

import com.cw.contentflow.DTO.CycleReport;
import com.cw.contentflow.DTO.SourceDescriptor;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 소스 1개의 런타임 상태 (상태 머신 + 마지막 실행 결과 + 타이머 핸들)
 */
public class SourceRuntime {
    private final AtomicReference<SourceState> state = new AtomicReference<>(SourceState.IDLE);
    private volatile SourceDescriptor descriptor;
    private volatile CycleReport lastRun;
    private volatile ScheduledFuture<?> timer;
    private volatile boolean retired; // 리로드로 빠진 소스

    public SourceRuntime(SourceDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    /**
     * IDLE → SCANNING 선점. 실패하면 이미 사이클이 돌고 있는 것.
     */
    public boolean tryStart() {
        return state.compareAndSet(SourceState.IDLE, SourceState.SCANNING);
    }

    public void advance(SourceState next) {
        state.set(next);
    }

    public void finish() {
        state.set(SourceState.IDLE);
    }

    public SourceState getState() {
        return state.get();
    }

    public boolean isIdle() {
        return state.get() == SourceState.IDLE;
    }

    public SourceDescriptor getDescriptor() {
        return descriptor;
    }

    public void setDescriptor(SourceDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    public CycleReport getLastRun() {
        return lastRun;
    }

    public void setLastRun(CycleReport lastRun) {
        this.lastRun = lastRun;
    }

    public void setTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    public boolean isRetired() {
        return retired;
    }

    public void setRetired(boolean retired) {
        this.retired = retired;
    }

    public void cancelTimer() {
        ScheduledFuture<?> t = this.timer;
        if (t != null) {
            t.cancel(false);
            this.timer = null;
        }
    }
}
