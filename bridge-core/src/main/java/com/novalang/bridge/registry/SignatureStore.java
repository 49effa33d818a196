package com.novalang.bridge.registry;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * 签名清单的 JSON 持久化
 *
 * <p>上一次构建保存的清单在下一次构建开始时载入，之后 {@link SignatureRegistry#needsRegeneration}
 * 就能与上一次的结果比较。格式：</p>
 * <pre>
 * {"version":1,"classes":[{"name":"Point","signature":"class:Point|...","hash":"9f2c..."}]}
 * </pre>
 */
public final class SignatureStore {

    private static final Logger LOG = Logger.getLogger(SignatureStore.class.getName());

    static final int VERSION = 1;

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private final Path file;

    public SignatureStore(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    public void save(SignatureRegistry registry) throws IOException {
        JsonArray classes = new JsonArray();
        for (ClassMetadata meta : registry.entries()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("name", meta.getName());
            entry.addProperty("signature", meta.getSignature());
            entry.addProperty("hash", meta.getHash());
            classes.add(entry);
        }
        JsonObject root = new JsonObject();
        root.addProperty("version", VERSION);
        root.add("classes", classes);

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(root, writer);
        }
        LOG.fine("Saved " + classes.size() + " class signature(s) to " + file);
    }

    /**
     * 载入清单到新的注册表；文件不存在时返回空注册表。
     *
     * @throws IOException 文件无法读取或格式错误
     */
    public SignatureRegistry load() throws IOException {
        SignatureRegistry registry = new SignatureRegistry();
        if (!Files.exists(file)) {
            return registry;
        }
        JsonObject root;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = gson.fromJson(reader, JsonObject.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed signature manifest: " + file, e);
        }
        if (root == null || !root.has("version") || root.get("version").getAsInt() != VERSION) {
            throw new IOException("Unsupported signature manifest version in " + file);
        }
        JsonArray classes = root.has("classes") ? root.getAsJsonArray("classes") : new JsonArray();
        for (JsonElement element : classes) {
            JsonObject entry = element.getAsJsonObject();
            String signature = entry.get("signature").getAsString();
            String hash = entry.has("hash") ? entry.get("hash").getAsString() : ContentHasher.sha256(signature);
            registry.restore(entry.get("name").getAsString(), signature, hash);
        }
        LOG.fine("Loaded " + registry.size() + " class signature(s) from " + file);
        return registry;
    }
}
