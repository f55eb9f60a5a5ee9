package com.eyelevel.videosynthesis.service.polling;

import com.eyelevel.videosynthesis.exception.TransientPollException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class PollRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        if (throwable instanceof TransientPollException) {
            log.warn("Status check failed on attempt {}: {}. Continuing...", context.getRetryCount(),
                     throwable.getMessage(), throwable.getCause());
        }
    }
}
