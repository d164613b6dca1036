package net.orrery.core.spi;

import java.util.concurrent.Callable;

/** Unit-of-work boundary. Repositories only work inside one of these. */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;
}
