package com.enterprise.autosave.download;

import com.enterprise.autosave.core.DownloadOutcome;
import com.enterprise.autosave.core.FailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams an HTTP resource to a file with a bounded overall timeout.
 *
 * <p>The body is copied in fixed size chunks, so memory use does not depend on the resource
 * size. An existing file at the output path is overwritten. When a transfer fails half way,
 * the partially written file is left in place. There is no retry: one call, one attempt.
 */
public class DownloadExecutor implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(DownloadExecutor.class);
    
    static final int CHUNK_SIZE = 8192;
    
    /**
     * How long a timed out call waits for its transfer thread to let go of the output file
     */
    static final Duration CANCEL_GRACE = Duration.ofSeconds(5);
    
    private final HttpClient client;
    private final String userAgent;
    private final ExecutorService transferPool;
    
    public DownloadExecutor(Duration connectTimeout, String userAgent) {
        this.client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(connectTimeout)
            .build();
        this.userAgent = userAgent;
        this.transferPool = Executors.newCachedThreadPool(new TransferThreadFactory());
    }
    
    /**
     * Download {@code url} to {@code outputPath}, giving up after {@code timeout}
     */
    public DownloadOutcome execute(String url, Path outputPath, Duration timeout) {
        long startTime = System.currentTimeMillis();
        TransferHandle handle = new TransferHandle();
        
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            return DownloadOutcome.failure(outputPath,
                FailureReason.transport("Invalid URL " + url + ": " + e.getMessage()), elapsed(startTime));
        }
        
        CompletableFuture<DownloadOutcome> transfer = CompletableFuture.supplyAsync(
            () -> transfer(request, outputPath, handle, startTime), transferPool);
        
        try {
            return transfer.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            
        } catch (TimeoutException e) {
            cancelAndAwait(handle, transfer, url);
            long executionTime = elapsed(startTime);
            logger.warn("Download of {} timed out after {}ms", url, executionTime);
            return DownloadOutcome.failure(outputPath,
                FailureReason.transport("Download timed out after " + timeout.toMillis() + "ms"), executionTime);
            
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Download of {} failed unexpectedly", url, cause);
            return DownloadOutcome.failure(outputPath,
                FailureReason.internal(cause.getClass().getSimpleName() + ": " + cause.getMessage()), elapsed(startTime));
            
        } catch (InterruptedException e) {
            handle.cancel(url);
            Thread.currentThread().interrupt();
            return DownloadOutcome.failure(outputPath,
                FailureReason.transport("Download interrupted"), elapsed(startTime));
        }
    }
    
    /**
     * Stops the transfer and waits for its thread to finish, so a later attempt on the same
     * path never writes alongside it
     */
    private static void cancelAndAwait(TransferHandle handle, CompletableFuture<DownloadOutcome> transfer, String url) {
        handle.cancel(url);
        try {
            transfer.get(CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Transfer of {} still running {}ms after cancellation", url, CANCEL_GRACE.toMillis());
        } catch (ExecutionException e) {
            logger.debug("Cancelled transfer of {} ended with an error", url, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
    
    private DownloadOutcome transfer(HttpRequest request, Path outputPath,
                                     TransferHandle handle, long startTime) {
        if (!handle.start()) {
            return cancelled(outputPath, startTime);
        }
        try {
            HttpResponse<InputStream> response;
            try {
                response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            } catch (HttpTimeoutException e) {
                return DownloadOutcome.failure(outputPath,
                    FailureReason.transport("Request timed out: " + e.getMessage()), elapsed(startTime));
            } catch (IOException e) {
                return DownloadOutcome.failure(outputPath,
                    FailureReason.transport(describe(e)), elapsed(startTime));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(outputPath, startTime);
            }
            
            InputStream in = response.body();
            try {
                if (!handle.attach(in)) {
                    return cancelled(outputPath, startTime);
                }
                int status = response.statusCode();
                if (status < 200 || status >= 300) {
                    logger.debug("Download of {} answered with status {}", request.uri(), status);
                    return DownloadOutcome.failure(outputPath, FailureReason.httpStatus(status), elapsed(startTime));
                }
                return copy(in, outputPath, handle, startTime);
            } finally {
                closeBody(in, request.uri().toString());
            }
        } finally {
            handle.finish();
        }
    }
    
    private DownloadOutcome copy(InputStream in, Path outputPath, TransferHandle handle, long startTime) {
        OutputStream out;
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            out = Files.newOutputStream(outputPath,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            return DownloadOutcome.failure(outputPath,
                FailureReason.storage("Cannot open " + outputPath + ": " + describe(e)), elapsed(startTime));
        }
        
        long written = 0;
        byte[] buffer = new byte[CHUNK_SIZE];
        try (out) {
            while (true) {
                if (handle.isCancelled()) {
                    return cancelled(outputPath, startTime);
                }
                int read;
                try {
                    read = in.read(buffer);
                } catch (IOException e) {
                    return DownloadOutcome.failure(outputPath,
                        FailureReason.transport("Read failed after " + written + " bytes: " + describe(e)),
                        elapsed(startTime));
                }
                if (read < 0) {
                    break;
                }
                out.write(buffer, 0, read);
                written += read;
            }
        } catch (IOException e) {
            return DownloadOutcome.failure(outputPath,
                FailureReason.storage("Write to " + outputPath + " failed: " + describe(e)), elapsed(startTime));
        }
        
        long executionTime = elapsed(startTime);
        logger.debug("Wrote {} bytes to {} in {}ms", written, outputPath, executionTime);
        return DownloadOutcome.success(outputPath, written, executionTime);
    }
    
    private static DownloadOutcome cancelled(Path outputPath, long startTime) {
        return DownloadOutcome.failure(outputPath, FailureReason.transport("Download cancelled"), elapsed(startTime));
    }
    
    private static void closeBody(InputStream in, String url) {
        if (in == null) {
            return;
        }
        try {
            in.close();
        } catch (IOException e) {
            logger.debug("Error closing response body of {}", url, e);
        }
    }
    
    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage()
                                      : e.getClass().getSimpleName();
    }
    
    private static long elapsed(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
    
    /**
     * Stop the transfer threads; transfers still running are interrupted
     */
    @Override
    public void close() {
        transferPool.shutdownNow();
    }
    
    /**
     * Cancellation state shared by one call and its transfer thread
     */
    private static class TransferHandle {
        private boolean cancelled;
        private Thread worker;
        private InputStream body;
        
        synchronized boolean start() {
            if (cancelled) {
                return false;
            }
            worker = Thread.currentThread();
            return true;
        }
        
        /**
         * @return false when the call was already cancelled, in which case the body must not be read
         */
        synchronized boolean attach(InputStream in) {
            if (cancelled) {
                return false;
            }
            body = in;
            return true;
        }
        
        synchronized boolean isCancelled() {
            return cancelled;
        }
        
        synchronized void finish() {
            worker = null;
            body = null;
            // Clear an interrupt aimed at this transfer before the pool thread is reused
            Thread.interrupted();
        }
        
        synchronized void cancel(String url) {
            cancelled = true;
            closeBody(body, url);
            if (worker != null) {
                worker.interrupt();
            }
        }
    }
    
    private static class TransferThreadFactory implements ThreadFactory {
        private final AtomicLong threadNumber = new AtomicLong(1);
        
        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "download-transfer-" + threadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
