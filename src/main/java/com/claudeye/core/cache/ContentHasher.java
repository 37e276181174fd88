package com.claudeye.core.cache;

import com.claudeye.core.evals.EvalsProperties;
import com.claudeye.core.transcript.SubagentFiles;
import com.claudeye.core.transcript.TranscriptProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.asm.ClassReader;
import org.springframework.asm.ClassVisitor;
import org.springframework.asm.ClassWriter;
import org.springframework.asm.MethodVisitor;
import org.springframework.asm.Opcodes;
import org.springframework.asm.SpringAsmInfo;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.lang.invoke.SerializedLambda;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.WeakHashMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes the identity hashes the cache validates against.
 * <p>
 * Every method returns the empty string when the underlying file cannot be
 * read; callers treat an empty hash as "uncacheable".
 */
@Component
public class ContentHasher {

    private static final Logger log = LoggerFactory.getLogger(ContentHasher.class);
    private static final String LAMBDA_MARKER = "$$Lambda";

    private final TranscriptProperties transcriptProperties;
    private final EvalsProperties evalsProperties;

    private final Map<Path, FileStamp> fileHashes = new ConcurrentHashMap<>();
    private final Map<Object, String> itemCodeHashes = Collections.synchronizedMap(new WeakHashMap<>());
    private volatile String directoryPathHash;

    public ContentHasher(TranscriptProperties transcriptProperties, EvalsProperties evalsProperties) {
        this.transcriptProperties = transcriptProperties;
        this.evalsProperties = evalsProperties;
    }

    /**
     * Hash of a transcript file derived from its size and modification time.
     * Transcripts are append-only, so this detects change without reading them.
     */
    public String hashFile(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            if (!attrs.isRegularFile()) {
                return "";
            }
            long size = attrs.size();
            long mtime = attrs.lastModifiedTime().toMillis();
            FileStamp known = fileHashes.get(path);
            if (known != null && known.size() == size && known.mtime() == mtime) {
                return known.hash();
            }
            String hash = sha256(mtime + ":" + size);
            fileHashes.put(path, new FileStamp(size, mtime, hash));
            return hash;
        } catch (IOException | RuntimeException e) {
            log.debug("Cannot stat {}: {}", path, e.getMessage());
            return "";
        }
    }

    /** {@code sessionKey} may be composite ({@code sessionId/agent-x}). */
    public String hashSessionFile(String projectName, String sessionKey) {
        return hashFile(transcriptProperties.resolvePath().resolve(projectName).resolve(sessionKey + ".jsonl"));
    }

    public String hashSubagentFile(String projectName, String sessionId, String agentId) {
        return SubagentFiles.locate(transcriptProperties.resolvePath(), projectName, sessionId, agentId)
                .map(this::hashFile)
                .orElse("");
    }

    /** Full-content hash of the configured evaluation module, or empty when none is configured. */
    public String hashModule() {
        Optional<Path> module = evalsProperties.modulePath();
        if (module.isEmpty()) {
            return "";
        }
        try {
            return sha256(Files.readAllBytes(module.get()));
        } catch (IOException e) {
            log.debug("Cannot read evals module {}: {}", module.get(), e.getMessage());
            return "";
        }
    }

    /**
     * Hash of one registered function's code. A lambda or method reference
     * hashes the bytecode of its implementation method only, so two lambdas
     * declared in the same class stay independent. Any other function hashes
     * the bytecode of its own class. Memoized per function instance.
     */
    public String hashItemCode(Object fn) {
        if (fn == null) {
            return "";
        }
        String cached = itemCodeHashes.get(fn);
        if (cached != null) {
            return cached;
        }
        String hash = computeItemCodeHash(fn);
        itemCodeHashes.put(fn, hash);
        return hash;
    }

    /**
     * First 8 hex characters of the SHA-256 of the resolved projects directory.
     * Namespaces the disk cache so different projects roots never collide.
     */
    public String hashDirectoryPath() {
        String hash = directoryPathHash;
        if (hash == null) {
            hash = sha256(transcriptProperties.resolvePath().toString()).substring(0, 8);
            directoryPathHash = hash;
        }
        return hash;
    }

    private String computeItemCodeHash(Object fn) {
        Class<?> type = fn.getClass();
        ClassLoader loader = type.getClassLoader() != null ? type.getClassLoader() : ClassLoader.getSystemClassLoader();
        String className = type.getName();
        int lambdaMarker = className.indexOf(LAMBDA_MARKER);
        if (lambdaMarker < 0) {
            return readClass(loader, className.replace('.', '/'))
                    .map(bytes -> sha256(bytes))
                    .orElseGet(() -> sha256(className));
        }

        Optional<SerializedLambda> lambda = serializedLambda(fn);
        if (lambda.isEmpty()) {
            // Not serializable: the best available identity is the host class.
            String hostClass = className.substring(0, lambdaMarker);
            return readClass(loader, hostClass.replace('.', '/'))
                    .map(bytes -> sha256(bytes))
                    .orElseGet(() -> sha256(hostClass));
        }
        SerializedLambda impl = lambda.get();
        String methodId = impl.getImplClass() + "#" + impl.getImplMethodName() + impl.getImplMethodSignature();
        return readClass(loader, impl.getImplClass())
                .flatMap(bytes -> methodBytecode(bytes, impl.getImplMethodName(), impl.getImplMethodSignature()))
                .map(bytes -> sha256(bytes))
                .orElseGet(() -> sha256(methodId));
    }

    private static Optional<SerializedLambda> serializedLambda(Object fn) {
        if (!(fn instanceof Serializable)) {
            return Optional.empty();
        }
        try {
            Method writeReplace = fn.getClass().getDeclaredMethod("writeReplace");
            writeReplace.setAccessible(true);
            return writeReplace.invoke(fn) instanceof SerializedLambda lambda ? Optional.of(lambda) : Optional.empty();
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.debug("Cannot resolve lambda implementation of {}: {}", fn.getClass().getName(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<byte[]> readClass(ClassLoader loader, String internalName) {
        try (InputStream in = loader.getResourceAsStream(internalName + ".class")) {
            return in != null ? Optional.of(in.readAllBytes()) : Optional.empty();
        } catch (IOException e) {
            log.debug("Cannot read bytecode of {}: {}", internalName, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Copies one method into an otherwise empty class and returns its bytes.
     * Debug info is dropped so moving the method within its file does not change the hash.
     */
    static Optional<byte[]> methodBytecode(byte[] classBytes, String name, String descriptor) {
        ClassWriter writer = new ClassWriter(0);
        writer.visit(Opcodes.V17, Opcodes.ACC_PUBLIC, "ItemCode", null, "java/lang/Object", null);
        boolean[] found = {false};
        new ClassReader(classBytes).accept(new ClassVisitor(SpringAsmInfo.ASM_VERSION) {
            @Override
            public MethodVisitor visitMethod(int access, String methodName, String methodDescriptor,
                                             String signature, String[] exceptions) {
                if (!methodName.equals(name) || !methodDescriptor.equals(descriptor)) {
                    return null;
                }
                found[0] = true;
                return writer.visitMethod(access, "item", methodDescriptor, signature, exceptions);
            }
        }, ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
        writer.visitEnd();
        return found[0] ? Optional.of(writer.toByteArray()) : Optional.empty();
    }

    static String sha256(String content) {
        return sha256(content.getBytes(StandardCharsets.UTF_8));
    }

    static String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record FileStamp(long size, long mtime, String hash) {}
}
