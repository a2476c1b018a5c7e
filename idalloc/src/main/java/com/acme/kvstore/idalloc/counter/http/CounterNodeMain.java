package com.acme.kvstore.idalloc.counter.http;

import com.acme.kvstore.idalloc.counter.InMemoryCounterStore;
import com.acme.kvstore.idalloc.lifecycle.Stopper;
import com.acme.kvstore.idalloc.util.EnvVars;
import com.acme.kvstore.idalloc.util.IdAllocDefaults;
import com.acme.kvstore.idalloc.util.IdAllocEnvKeys;

import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Runs a standalone, process-local counter node that allocators on other
 * processes reach through {@link HttpCounterStore}.
 *
 * <p>Port comes from the first argument, else {@code IDALLOC_COUNTER_HTTP_PORT}.
 */
public final class CounterNodeMain {
    private static final Logger LOG = Logger.getLogger(CounterNodeMain.class.getName());

    private CounterNodeMain() {}

    public static void main(String[] args) throws Exception {
        int port = args.length > 0
            ? Integer.parseInt(args[0])
            : EnvVars.getIntClamped(IdAllocEnvKeys.IDALLOC_COUNTER_HTTP_PORT,
                IdAllocDefaults.DEFAULT_COUNTER_HTTP_PORT, 0, 65_535);

        Stopper stopper = new Stopper();
        NettyCounterHttpServer server = start(port, stopper);
        Runtime.getRuntime().addShutdownHook(new Thread(stopper::stop, "counter-node-shutdown"));
        LOG.info(() -> "Counter node ready on port " + server.boundPort());

        while (!stopper.awaitStopped(1, TimeUnit.HOURS)) {
            // keep the main thread alive until the shutdown hook has run
        }
    }

    /**
     * Starts a node on {@code port} backed by a fresh in-memory store and
     * registers it with {@code stopper} so that stopping closes it.
     */
    static NettyCounterHttpServer start(int port, Stopper stopper) throws Exception {
        InMemoryCounterStore store = new InMemoryCounterStore();
        NettyCounterHttpServer server = new NettyCounterHttpServer(port, store);
        server.start();
        stopper.addCloser(server);
        stopper.addCloser(store);
        return server;
    }
}
