package com.questrail.empire.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.empire.config.EmpireLinkConfig;
import com.questrail.empire.directory.ConnectionDirectory;
import com.questrail.empire.directory.GgeConnectionFactory;
import com.questrail.empire.directory.OkHttpServerListFetcher;
import com.questrail.empire.directory.ServerListFetcher;
import com.questrail.empire.directory.ServerListParser;
import com.questrail.empire.directory.StaticCredentialsSource;
import com.questrail.empire.gateway.CommandGateway;
import com.questrail.empire.gateway.CommandHeaderMappings;
import com.questrail.empire.protocol.gge.internal.time.MonotonicClock;
import com.questrail.empire.protocol.gge.internal.time.ScheduledExecutorScheduler;
import com.questrail.empire.protocol.gge.internal.time.SystemMonotonicClock;
import com.questrail.empire.protocol.gge.observability.GgeObservabilitySink;
import com.questrail.empire.protocol.gge.observability.Slf4jGgeObservabilitySink;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * EmpireLinkRuntime
 * =============================================================================
 * Composition root and lifecycle owner of the production stack.
 *
 * <h2>Owned resources</h2>
 * <ul>
 *   <li>One Netty {@link EventLoopGroup} shared by every transport.</li>
 *   <li>One scheduled executor running connect routines, heartbeats, checks and
 *       reconnects for every zone.</li>
 *   <li>The OkHttp client used for server lists, when the default fetcher is used.</li>
 * </ul>
 */
public final class EmpireLinkRuntime {
    private static final Logger log = LoggerFactory.getLogger(EmpireLinkRuntime.class);

    private final ConnectionDirectory directory;
    private final CommandGateway gateway;
    private final EventLoopGroup eventLoopGroup;
    private final ScheduledExecutorService schedulerExecutor;
    private final OkHttpServerListFetcher ownedFetcher;

    private EmpireLinkRuntime(
            ConnectionDirectory directory,
            CommandGateway gateway,
            EventLoopGroup eventLoopGroup,
            ScheduledExecutorService schedulerExecutor,
            OkHttpServerListFetcher ownedFetcher) {
        this.directory = directory;
        this.gateway = gateway;
        this.eventLoopGroup = eventLoopGroup;
        this.schedulerExecutor = schedulerExecutor;
        this.ownedFetcher = ownedFetcher;
    }

    /**
     * Discover zones and start connecting all of them. Returns once every connect
     * routine has been scheduled.
     */
    public void start() {
        directory.discover();
        directory.connectAll();
        log.info("Started {} connection(s)", directory.zones().size());
    }

    public void stop() {
        directory.closeAll();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        eventLoopGroup.shutdownGracefully();
        if (ownedFetcher != null) {
            ownedFetcher.shutdown();
        }
    }

    public CommandGateway gateway() {
        return gateway;
    }

    public ConnectionDirectory directory() {
        return directory;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EmpireLinkConfig config;
        private GgeObservabilitySink observabilitySink = new Slf4jGgeObservabilitySink();
        private ServerListFetcher fetcher;
        private CommandHeaderMappings headerMappings;
        private ObjectMapper mapper = new ObjectMapper();

        public Builder withConfig(EmpireLinkConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(GgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withServerListFetcher(ServerListFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder withCommandHeaderMappings(CommandHeaderMappings mappings) {
            this.headerMappings = mappings;
            return this;
        }

        public Builder withObjectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public EmpireLinkRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(mapper, "mapper");

            // 1. Threads: Netty I/O and the blocking scheduler pool
            EventLoopGroup group = new NioEventLoopGroup();
            ScheduledExecutorService schedulerExec =
                    Executors.newScheduledThreadPool(config.schedulerThreads(), new NamedThreadFactory("empire-scheduler"));
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Connections
            GgeConnectionFactory connectionFactory = new GgeConnectionFactory(
                    GgeConnectionFactory.netty(group),
                    scheduler,
                    clock,
                    config.timingPolicy(),
                    observabilitySink,
                    mapper,
                    config.extraLoginCommand());

            OkHttpServerListFetcher ownedFetcher = null;
            ServerListFetcher serverLists = fetcher;
            if (serverLists == null) {
                ownedFetcher = new OkHttpServerListFetcher();
                serverLists = ownedFetcher;
            }

            ConnectionDirectory directory = new ConnectionDirectory(
                    config.feeds(),
                    serverLists,
                    new ServerListParser(),
                    config.allowedZones(),
                    new StaticCredentialsSource(config.credentials()),
                    connectionFactory);

            // 3. External boundary
            CommandHeaderMappings mappings = headerMappings != null ? headerMappings : config.commandMappings();
            CommandGateway gateway = new CommandGateway(directory, mappings, mapper);

            return new EmpireLinkRuntime(directory, gateway, group, schedulerExec, ownedFetcher);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            return new Thread(r, prefix + "-" + counter.incrementAndGet());
        }
    }
}
