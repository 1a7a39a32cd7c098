package villagecompute.noos;

import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import villagecompute.noos.commands.CommandDispatcher;

/**
 * Command-line entry point. The process exit status is the status returned by the dispatched command.
 */
@QuarkusMain
public class NoosApplication implements QuarkusApplication {

    @Inject
    CommandDispatcher dispatcher;

    @Override
    public int run(String... args) {
        return dispatcher.dispatch(args);
    }
}
