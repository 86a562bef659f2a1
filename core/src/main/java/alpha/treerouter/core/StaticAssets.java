package alpha.treerouter.core;

import alpha.treerouter.Router;
import alpha.treerouter.handler.ClientChannel;
import alpha.treerouter.handler.RequestHandler;
import alpha.treerouter.message.Request;
import alpha.treerouter.message.Responses;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Map.entry;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * Registers a GET route for each file found in a directory.<p>
 *
 * Given the root directory "/var/www/public" with the files "app.css" and
 * "img/logo.png", {@link #serve(Router)} registers the routes
 * "/public/app.css" and "/public/img/logo.png". The Content-Type of the
 * response is derived from the file extension. The file is read when the
 * request is handled; a file that can not be read fails the request handler
 * and the failure is delivered to the router's error handler.<p>
 *
 * Files added to the directory after {@code serve} was called are not
 * served. A file whose path contains a segment starting with a colon is
 * skipped.
 *
 * @author TreeRouter authors
 */
public final class StaticAssets
{
    private static final System.Logger LOG
            = System.getLogger(StaticAssets.class.getPackageName());

    private static final String OCTET_STREAM = "application/octet-stream";

    private static final Map<String, String> CONTENT_TYPES = Map.ofEntries(
            entry("css",  "text/css"),
            entry("js",   "application/javascript"),
            entry("mjs",  "application/javascript"),
            entry("png",  "image/png"),
            entry("jpg",  "image/jpeg"),
            entry("jpeg", "image/jpeg"),
            entry("gif",  "image/gif"),
            entry("avif", "image/avif"),
            entry("svg",  "image/svg+xml"),
            entry("ico",  "image/x-icon"),
            entry("webp", "image/webp"));

    private final Path root;

    /**
     * Constructs a {@code StaticAssets}.
     *
     * @param root directory
     *
     * @throws NullPointerException
     *             if {@code root} is {@code null}
     */
    public StaticAssets(Path root) {
        this.root = requireNonNull(root).toAbsolutePath().normalize();
    }

    /**
     * Registers a GET route for each regular file in the root directory and
     * its subdirectories.
     *
     * @param router to register routes with
     *
     * @return the router
     *
     * @throws NullPointerException
     *             if {@code router} is {@code null}
     * @throws NotDirectoryException
     *             if the root is not a directory
     * @throws IOException
     *             if an I/O error occurs while walking the directory
     */
    public Router serve(Router router) throws IOException {
        requireNonNull(router);
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        final List<Path> files;
        try (Stream<Path> s = Files.walk(root)) {
            files = s.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        final String prefix = "/" + root.getFileName();
        int n = 0;
        for (Path f : files) {
            String pattern = prefix + toPattern(root.relativize(f));
            if (pattern.contains("/:")) {
                LOG.log(WARNING, () -> "Skipping file with colon-prefixed segment: " + f);
                continue;
            }
            router.get(pattern, new FileHandler(f, contentType(f.getFileName().toString())));
            LOG.log(DEBUG, () -> "Serving " + f + " at " + pattern);
            ++n;
        }
        final int count = n;
        LOG.log(INFO, () -> "Serving " + count + " file(s) from " + root + ".");
        return router;
    }

    private static String toPattern(Path relative) {
        StringBuilder b = new StringBuilder();
        for (Path p : relative) {
            b.append('/').append(p);
        }
        return b.toString();
    }

    /**
     * Returns the Content-Type for the given file name.
     *
     * @param fileName name of file
     *
     * @return the Content-Type ("application/octet-stream" if unknown)
     */
    static String contentType(String fileName) {
        final int dot = fileName.lastIndexOf('.');
        if (dot == -1) {
            return OCTET_STREAM;
        }
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return CONTENT_TYPES.getOrDefault(ext, OCTET_STREAM);
    }

    private static final class FileHandler implements RequestHandler {
        private final Path file;
        private final String contentType;

        FileHandler(Path file, String contentType) {
            this.file = file;
            this.contentType = contentType;
        }

        @Override
        public CompletionStage<Void> handle(Request request, ClientChannel channel) throws IOException {
            channel.write(Responses.ok(Files.readAllBytes(file), contentType));
            return completedStage(null);
        }

        @Override
        public String toString() {
            return "File{" + file.getFileName() + ", " + contentType + "}";
        }
    }
}
