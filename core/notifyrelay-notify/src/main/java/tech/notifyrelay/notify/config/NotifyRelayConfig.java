package tech.notifyrelay.notify.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration shared by the relay process and the streaming workers.
 *
 * <p>{@code use-bus} is read once at startup. There is no runtime reconfiguration of
 * the channel set; relay and workers must be deployed with the same list.</p>
 */
@ConfigMapping(prefix = "notify-relay")
public interface NotifyRelayConfig {

    /**
     * Workers subscribe to the Redis bus instead of holding their own LISTEN connection.
     * If false, every worker runs permanently in direct mode.
     */
    @WithDefault("false")
    boolean useBus();

    /**
     * Fixed delay between reconnect attempts, for both upstream and bus connections.
     */
    @WithDefault("5s")
    Duration reconnectInterval();

    /**
     * Relayed NOTIFY channels.
     */
    @WithDefault("matchdata_change,match_change,scoreboard_change,playclock_change,gameclock_change,football_event_change,player_match_change")
    List<String> channels();

    Bus bus();

    Upstream upstream();

    Session session();

    interface Bus {
        /**
         * Redis connection string.
         */
        @WithDefault("redis://localhost:6379")
        String url();

        /**
         * Redis pub/sub channel carrying the event envelopes.
         */
        @WithDefault("pg_notify:events")
        String channel();

        @WithDefault("5s")
        Duration connectTimeout();
    }

    interface Upstream {
        @WithDefault("jdbc:postgresql://localhost:5432/postgres")
        String jdbcUrl();

        Optional<String> username();

        Optional<String> password();

        /**
         * How long one poll for notifications blocks before checking for shutdown.
         */
        @WithDefault("500ms")
        Duration pollTimeout();
    }

    interface Session {
        /**
         * Outbound events buffered per client session before it is evicted as backpressured.
         */
        @WithDefault("256")
        int queueCapacity();
    }
}
