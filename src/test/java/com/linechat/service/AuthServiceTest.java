package com.linechat.service;

import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AuthServiceTest {
  @TempDir
  Path dir;

  private Path usersFile;
  private AuthService auth;

  @BeforeEach
  void setUp() {
    usersFile = dir.resolve("users.json");
    auth = new AuthService(usersFile, 4);
  }

  @Test
  void missingFileIsCreatedEmpty() throws Exception {
    assertTrue(auth.loadUsers().isEmpty());
    assertTrue(Files.exists(usersFile));
    assertEquals(0, new JSONObject(Files.readString(usersFile)).length());
  }

  @Test
  void registeredUserCanLogIn() {
    assertTrue(auth.registerUser("user1", "password1"));

    assertTrue(auth.authenticate("user1", "password1"));
    assertFalse(auth.authenticate("user1", "wrong_password"));
    assertFalse(auth.authenticate("user2", "password1"));
  }

  @Test
  void passwordsAreStoredHashed() throws Exception {
    auth.registerUser("user1", "password1");

    String stored = new JSONObject(Files.readString(usersFile)).getString("user1");
    assertNotEquals("password1", stored);
    assertTrue(stored.startsWith("$2"));
  }

  @Test
  void duplicateUsernameIsRefusedAndKeepsOriginalPassword() {
    assertTrue(auth.registerUser("user1", "password1"));
    assertFalse(auth.registerUser("user1", "other"));
    assertFalse(auth.registerUser("  user1 ", "other"));

    assertTrue(auth.authenticate("user1", "password1"));
    assertFalse(auth.authenticate("user1", "other"));
  }

  @Test
  void blankUsernameIsRefused() {
    assertFalse(auth.registerUser("", "password"));
    assertFalse(auth.registerUser("   ", "password"));
    assertFalse(auth.registerUser(null, "password"));
    assertTrue(auth.loadUsers().isEmpty());
  }

  @Test
  void emptyPasswordIsAllowed() {
    assertTrue(auth.registerUser("new_user", ""));
    assertTrue(auth.authenticate("new_user", ""));
    assertFalse(auth.authenticate("new_user", null));
  }

  @Test
  void legacySha256HashesStillAuthenticate() throws Exception {
    String legacy = AuthService.sha256Hex("password1");
    assertEquals("0b14d501a594442a01c6859541bcb3e8164d183d32937b851835442f69d5c94e", legacy);
    Files.writeString(usersFile, new JSONObject().put("user1", legacy).toString(), StandardCharsets.UTF_8);

    assertTrue(auth.authenticate("user1", "password1"));
    assertFalse(auth.authenticate("user1", "password2"));
  }

  @Test
  void unrecognisedHashNeverMatches() throws Exception {
    Files.writeString(usersFile, "{\"user1\": \"not_a_hash\", \"user2\": \"$2a$broken\"}");

    assertFalse(auth.authenticate("user1", "password1"));
    assertFalse(auth.authenticate("user2", "password1"));
  }

  @Test
  void malformedFileIsReported() throws Exception {
    Files.writeString(usersFile, "{invalid_json: True,");

    assertThrows(CredentialStoreException.class, () -> auth.authenticate("user1", "password1"));
    assertThrows(CredentialStoreException.class, () -> auth.registerUser("user1", "password1"));
  }

  @Test
  void writesLeaveNoTemporaryFilesBehind() throws Exception {
    auth.registerUser("a", "1");
    auth.registerUser("b", "2");

    try (Stream<Path> files = Files.list(dir)) {
      assertEquals(List.of(usersFile), files.collect(Collectors.toList()));
    }
  }

  @Test
  void concurrentRegistrationsAreAllKept() throws Exception {
    AuthService other = new AuthService(usersFile, 4);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    List<Future<Boolean>> results = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      AuthService service = i % 2 == 0 ? auth : other;
      String name = "user" + i;
      results.add(pool.submit(() -> service.registerUser(name, "pw")));
    }
    for (Future<Boolean> r : results) {
      assertTrue(r.get(30, TimeUnit.SECONDS));
    }
    pool.shutdown();

    assertEquals(40, auth.loadUsers().size());
  }
}
