package io.livedoc.service.notify;

/**
 * Source of committed changes observed from the shared store, feeding a {@link ChangeNotifier}.
 */
public interface ChangeFeed {

    void start();

    void stop();

    boolean isRunning();
}
