package com.eyelevel.videosynthesis.service.polling;

import java.io.Serial;

class PollCancelledException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -1471209433530151870L;

    PollCancelledException(String taskId) {
        super("Polling of task " + taskId + " was cancelled", null, false, false);
    }
}
