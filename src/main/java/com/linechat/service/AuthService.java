package com.linechat.service;

import org.json.JSONException;
import org.json.JSONObject;
import org.mindrot.jbcrypt.BCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Username/password store backed by a flat JSON file ({@code username -> hash}).
 *
 * <p>The client calls this before it connects; the chat server never sees passwords.
 */
public class AuthService {
  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  // one lock per file, shared by every AuthService on it
  private static final Map<Path, ReentrantReadWriteLock> LOCKS = new ConcurrentHashMap<>();

  private final Path usersFile;
  private final int logRounds;
  private final ReentrantReadWriteLock lock;

  public AuthService(Path usersFile) {
    this(usersFile, 10);
  }

  /** @param logRounds BCrypt cost factor for newly stored hashes */
  public AuthService(Path usersFile, int logRounds) {
    this.usersFile = usersFile;
    this.logRounds = logRounds;
    this.lock = LOCKS.computeIfAbsent(usersFile.toAbsolutePath().normalize(), p -> new ReentrantReadWriteLock());
  }

  /**
   * Stores a new user.
   *
   * @return {@code false} if the username is blank, the password missing, or the name taken
   */
  public boolean registerUser(String username, String password) {
    String uname = normalize(username);
    if (uname.isEmpty() || password == null) {
      return false;
    }
    lock.writeLock().lock();
    try {
      JSONObject users = readUsers();
      if (users.has(uname)) {
        return false;
      }
      users.put(uname, BCrypt.hashpw(password, BCrypt.gensalt(logRounds)));
      writeUsers(users);
      log.debug("Registered user {}", uname);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public boolean authenticate(String username, String password) {
    if (password == null) {
      return false;
    }
    String stored = loadUsers().get(normalize(username));
    return stored != null && matches(password, stored);
  }

  /**
   * Current contents of the store. Creates an empty store if the file does not exist yet.
   */
  public Map<String, String> loadUsers() {
    if (Files.notExists(usersFile)) {
      lock.writeLock().lock();
      try {
        if (Files.notExists(usersFile)) {
          writeUsers(new JSONObject());
        }
      } finally {
        lock.writeLock().unlock();
      }
    }
    lock.readLock().lock();
    try {
      JSONObject users = readUsers();
      Map<String, String> result = new HashMap<>();
      for (String name : users.keySet()) {
        result.put(name, users.optString(name, ""));
      }
      return Collections.unmodifiableMap(result);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * BCrypt hashes are checked as such. Plain 64-digit hex values are unsalted SHA-256 hashes
   * written by older versions of the tool.
   */
  static boolean matches(String password, String storedHash) {
    if (storedHash.startsWith("$2")) {
      try {
        return BCrypt.checkpw(password, storedHash);
      } catch (IllegalArgumentException | StringIndexOutOfBoundsException e) {
        log.warn("Stored BCrypt hash is malformed: {}", e.getMessage());
        return false;
      }
    }
    if (storedHash.matches("[0-9a-fA-F]{64}")) {
      return MessageDigest.isEqual(
          sha256Hex(password).getBytes(StandardCharsets.US_ASCII),
          storedHash.toLowerCase().getBytes(StandardCharsets.US_ASCII));
    }
    return false;
  }

  static String sha256Hex(String password) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(password.getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder(digest.length * 2);
      for (byte b : digest) {
        sb.append(String.format("%02x", b));
      }
      return sb.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private JSONObject readUsers() {
    if (Files.notExists(usersFile)) {
      return new JSONObject();
    }
    String text;
    try {
      text = Files.readString(usersFile, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new CredentialStoreException("Cannot read user file " + usersFile, e);
    }
    if (text.isBlank()) {
      return new JSONObject();
    }
    try {
      return new JSONObject(text);
    } catch (JSONException e) {
      throw new CredentialStoreException("Malformed user file " + usersFile + ": " + e.getMessage(), e);
    }
  }

  // caller holds the write lock
  private void writeUsers(JSONObject users) {
    Path dir = usersFile.toAbsolutePath().getParent();
    Path tmp = null;
    try {
      tmp = Files.createTempFile(dir, usersFile.getFileName().toString(), ".tmp");
      Files.writeString(tmp, users.toString(4), StandardCharsets.UTF_8);
      try {
        Files.move(tmp, usersFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, usersFile, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteTemp(tmp);
      throw new CredentialStoreException("Cannot write user file " + usersFile, e);
    }
  }

  private void deleteTemp(Path tmp) {
    if (tmp == null) return;
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("Could not delete temporary file {}: {}", tmp, e.getMessage());
    }
  }

  private String normalize(String s) {
    return s == null ? "" : s.trim();
  }
}
