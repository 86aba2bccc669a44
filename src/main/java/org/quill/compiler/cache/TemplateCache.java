package org.quill.compiler.cache;

import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.ITemplateParser;
import org.quill.compiler.frontend.parser.ast.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caches parsed templates in front of another {@link ITemplateParser}.
 * <p>
 * Entries are keyed by file name and a SHA-256 fingerprint of the source, so an edited
 * file is parsed again without explicit invalidation. The least recently used entry is
 * evicted once {@code maxEntries} is exceeded. Templates are immutable, so one instance
 * can serve concurrent compiles.
 */
public class TemplateCache implements ITemplateParser {

    private static final Logger log = LoggerFactory.getLogger(TemplateCache.class);

    private final ITemplateParser delegate;
    private final Map<String, Template> entries;
    private long hits;
    private long misses;

    /**
     * @param delegate The parser used on a miss.
     * @param maxEntries The maximum number of cached templates.
     */
    public TemplateCache(ITemplateParser delegate, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive, was " + maxEntries);
        }
        this.delegate = delegate;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Template> eldest) {
                boolean evict = size() > maxEntries;
                if (evict) {
                    log.debug("Evicting {} from the template cache", eldest.getValue().fileName());
                }
                return evict;
            }
        };
    }

    @Override
    public Template parse(String source, String fileName) throws TemplateSyntaxException {
        String key = fileName + '@' + fingerprint(source);
        synchronized (this) {
            Template cached = entries.get(key);
            if (cached != null) {
                hits++;
                return cached;
            }
            misses++;
        }
        Template parsed = delegate.parse(source, fileName);
        synchronized (this) {
            entries.put(key, parsed);
        }
        return parsed;
    }

    public synchronized long getHits() {
        return hits;
    }

    public synchronized long getMisses() {
        return misses;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    private static String fingerprint(String source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(source.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
