package tech.notifyrelay.notify.config;

import io.vertx.core.Vertx;
import io.vertx.core.net.NetClientOptions;
import io.vertx.redis.client.Redis;
import io.vertx.redis.client.RedisOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.notifyrelay.notify.bus.BusClient;
import tech.notifyrelay.notify.bus.RedisBusClient;
import tech.notifyrelay.notify.codec.EventCodec;
import tech.notifyrelay.notify.model.ChannelSet;
import tech.notifyrelay.notify.upstream.PgConnectionFactory;
import tech.notifyrelay.notify.upstream.PgNotifyClient;
import tech.notifyrelay.notify.upstream.UpstreamClientFactory;

/**
 * CDI producers for the channel set, the upstream client factory and the bus client.
 *
 * <p>The bus client is created lazily by CDI but does not connect until
 * {@link BusClient#listen()} is called by its owner.</p>
 */
@ApplicationScoped
public class NotifyRelayProducers {

    private static final Logger LOG = Logger.getLogger(NotifyRelayProducers.class);

    @Inject
    NotifyRelayConfig config;

    @Inject
    Vertx vertx;

    @Produces
    @Singleton
    public ChannelSet channelSet() {
        ChannelSet channels = ChannelSet.of(config.channels());
        LOG.infof("Relayed channel set: %s", channels);
        return channels;
    }

    @Produces
    @Singleton
    public EventCodec eventCodec() {
        return new EventCodec();
    }

    @Produces
    @Singleton
    public UpstreamClientFactory upstreamClientFactory(EventCodec codec) {
        NotifyRelayConfig.Upstream upstream = config.upstream();
        PgConnectionFactory connectionFactory = PgConnectionFactory.driverManager(
            upstream.jdbcUrl(), upstream.username(), upstream.password());
        return owner -> new PgNotifyClient(connectionFactory, codec, upstream.pollTimeout(), owner);
    }

    @Produces
    @Singleton
    public BusClient busClient(EventCodec codec) {
        NotifyRelayConfig.Bus bus = config.bus();
        RedisOptions options = new RedisOptions()
            .setConnectionString(bus.url())
            .setNetClientOptions(new NetClientOptions()
                .setConnectTimeout((int) bus.connectTimeout().toMillis())
                .setTcpKeepAlive(true));
        Redis redis = Redis.createClient(vertx, options);
        return new RedisBusClient(redis, bus.channel(), config.reconnectInterval(), bus.connectTimeout(), codec);
    }

    void closeBusClient(@Disposes BusClient busClient) {
        busClient.stop();
    }
}
