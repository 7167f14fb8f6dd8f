package com.example.logrelay.upstream;

import com.example.logrelay.model.ProgressRecord;

/**
 * Drops a progress record when it repeats the previous record's stage,
 * status and percentage.
 */
public final class DistinctProgressListener implements StreamListener<ProgressRecord> {
    private final StreamListener<ProgressRecord> delegate;
    private ProgressRecord previous;

    public DistinctProgressListener(StreamListener<ProgressRecord> delegate) {
        this.delegate = delegate;
    }

    @Override
    public void onRecord(ProgressRecord record) {
        synchronized (this) {
            if (record.sameStateAs(previous)) return;
            previous = record;
        }
        delegate.onRecord(record);
    }

    @Override
    public void onError(UpstreamException error) {
        delegate.onError(error);
    }

    @Override
    public void onComplete() {
        delegate.onComplete();
    }
}
