package dk.cloudcreate.cqrs.common;

/**
 * Start/stop contract shared by the long running components (event stores, transports, dispatchers)
 */
public interface Lifecycle {
    /**
     * Start the component. Calling {@link #start()} on a component that is already started is a no-op
     */
    void start();

    /**
     * Stop the component and release the resources it holds. Calling {@link #stop()} on a component
     * that isn't started is a no-op
     */
    void stop();

    /**
     * @return true if {@link #start()} has been called and the component hasn't been stopped since
     */
    boolean isStarted();
}
