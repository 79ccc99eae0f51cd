package tech.notifyrelay.notify.upstream;

/**
 * Creates fresh upstream clients; every (re)connect uses a new instance.
 */
@FunctionalInterface
public interface UpstreamClientFactory {

    /**
     * @param owner short label of the owning component, used in thread names and logs
     */
    UpstreamSubscriptionClient create(String owner);
}
