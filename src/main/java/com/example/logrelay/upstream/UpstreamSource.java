package com.example.logrelay.upstream;

import com.example.logrelay.model.LogRecord;
import com.example.logrelay.model.ProgressRecord;

/**
 * The external worker-orchestration process. Each call opens one long-lived
 * server stream; failures are reported either by throwing from the open
 * method or through {@link UpstreamObserver#onError}.
 */
public interface UpstreamSource {

    UpstreamCall openLogStream(String jobId, UpstreamObserver<LogRecord> observer);

    UpstreamCall openProgressStream(String pipelineId, UpstreamObserver<ProgressRecord> observer);
}
