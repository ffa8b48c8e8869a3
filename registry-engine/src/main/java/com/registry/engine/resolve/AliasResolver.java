package com.registry.engine.resolve;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.RegistryException;
import com.registry.core.exception.StorageException;
import com.registry.core.model.AliasPointer;
import com.registry.core.model.Identifiers;
import com.registry.core.model.ModelRef;
import com.registry.core.model.RegistryLayout;
import com.registry.core.model.StoragePath;
import com.registry.core.model.VersionId;
import com.registry.core.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves {@code model} / {@code model@qualifier} references to committed versions.
 *
 * The qualifier is looked up as an alias first and as a literal version
 * second. Resolution takes no lock: alias files are replaced atomically, so
 * a reader sees the old or the new target. The target is re-checked on
 * every call and a dangling alias is reported as not found.
 */
public class AliasResolver {

    private static final Logger log = LoggerFactory.getLogger(AliasResolver.class);

    private final StorageBackend backend;
    private final ObjectMapper objectMapper;

    public AliasResolver(StorageBackend backend, ObjectMapper objectMapper) {
        this.backend = backend;
        this.objectMapper = objectMapper;
    }

    /**
     * Resolve a reference string within a task.
     *
     * @throws com.registry.core.exception.RegistryValidationException if the reference is malformed
     * @throws NotFoundException if neither an alias nor a version matches
     */
    public ResolvedReference resolve(String task, String ref) {
        Identifiers.requireValid("task", task);
        return resolve(task, ModelRef.parse(ref));
    }

    public ResolvedReference resolve(String task, ModelRef ref) {
        Optional<AliasPointer> alias = readAlias(task, ref.model(), ref.qualifier());
        if (alias.isPresent()) {
            VersionId target = new VersionId(task, ref.model(), alias.get().version());
            StoragePath path = RegistryLayout.versionPath(target);
            if (!backend.exists(path)) {
                log.warn("Alias {} of {}/{} points at missing version {}",
                    ref.qualifier(), task, ref.model(), target.version());
                throw notFound("Version", target.toString(), task, ref)
                    .with(RegistryException.CTX_VERSION, target.version());
            }
            return new ResolvedReference(target, path, ref.qualifier());
        }

        VersionId literal = new VersionId(task, ref.model(), ref.qualifier());
        StoragePath path = RegistryLayout.versionPath(literal);
        if (backend.exists(path)) {
            return new ResolvedReference(literal, path, null);
        }
        throw notFound("Reference", task + "/" + ref, task, ref);
    }

    /**
     * Read an alias pointer, empty if the alias was never set.
     *
     * @throws StorageException if the alias file is unreadable
     */
    public Optional<AliasPointer> readAlias(String task, String model, String alias) {
        StoragePath path = RegistryLayout.aliasPath(task, model, alias);
        byte[] content;
        try {
            content = backend.readAll(path);
        } catch (NotFoundException e) {
            return Optional.empty();
        }
        AliasPointer pointer;
        try {
            pointer = objectMapper.readValue(content, AliasPointer.class);
        } catch (IOException e) {
            throw malformed(path, e);
        }
        if (!Identifiers.isValid(pointer.version())) {
            throw malformed(path, null);
        }
        return Optional.of(pointer);
    }

    /**
     * Every alias of a model, ordered by alias name.
     */
    public List<AliasPointer> listAliases(String task, String model) {
        List<AliasPointer> aliases = new ArrayList<>();
        for (String name : backend.listChildren(RegistryLayout.aliasesRoot(task, model))) {
            if (!name.endsWith(AliasPointer.FILE_SUFFIX)) {
                continue;
            }
            String alias = name.substring(0, name.length() - AliasPointer.FILE_SUFFIX.length());
            readAlias(task, model, alias).ifPresent(aliases::add);
        }
        return aliases;
    }

    private StorageException malformed(StoragePath path, Exception cause) {
        String message = "Malformed alias file " + backend.locate(path);
        StorageException e = cause == null ? new StorageException(message) : new StorageException(message, cause);
        return (StorageException) e.with(StorageException.CTX_PATH, backend.locate(path));
    }

    private static RegistryException notFound(String entityType, String entityId, String task, ModelRef ref) {
        return new NotFoundException(entityType, entityId)
            .with(RegistryException.CTX_TASK, task)
            .with(RegistryException.CTX_MODEL, ref.model())
            .with(RegistryException.CTX_ALIAS, ref.qualifier());
    }
}
