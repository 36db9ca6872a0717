package com.lintmux.dispatch.cli;

import com.lintmux.dispatch.host.StdioHostTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: lintmux serve
 * <p>
 * Serves one host over stdin/stdout until it sends {@code plugin.shutdown} or
 * closes stdin. Nothing else may write to stdout in this mode; logs go to
 * stderr.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Serve an analysis host over stdin/stdout")
@Component
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    private final StdioHostTransport transport;

    public ServeCommand(StdioHostTransport transport) {
        this.transport = transport;
    }

    @Override
    public Integer call() throws Exception {
        log.info("Lintmux serving on stdio");
        transport.serve(System.in, System.out);
        return 0;
    }
}
