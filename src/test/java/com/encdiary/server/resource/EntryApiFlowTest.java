package com.encdiary.server.resource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

import com.encdiary.server.dto.EntryRequest;
import com.encdiary.server.dto.EntryView;
import com.encdiary.server.model.UserAccount;
import com.encdiary.server.security.DiaryPrincipal;
import com.encdiary.server.security.ResetTokenCodec;
import com.encdiary.server.service.EntryService;
import com.encdiary.server.service.UserService;
import com.encdiary.server.support.MutableClock;
import com.encdiary.server.support.TestDatabase;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;

/**
 * Register, log in and drive the entry API against a real database.
 */
class EntryApiFlowTest {

    private TestDatabase db;
    private MutableClock clock;
    private UserService users;
    private EntryResource resource;

    @BeforeEach
    void setUp() {
        db = new TestDatabase();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        users = new UserService(db.emf(),
                new ResetTokenCodec("flow-test", ResetTokenCodec.PASSWORD_RESET_PURPOSE, clock));
        resource = new EntryResource(new EntryService(db.emf(), clock));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void createListUpdateDelete() {
        users.register("a@x.com", "pw");
        SecurityContext alice = loginAs("a@x.com", "pw");

        Response created = resource.create(alice, new EntryRequest("t1", "c1"));
        assertEquals(201, created.getStatus());
        long id = (Long) ((Map<?, ?>) created.getEntity()).get("id");
        assertEquals("2024-05-01 10:00:00", ((Map<?, ?>) created.getEntity()).get("date_modified"));

        List<EntryView> listed = entities(resource.list(alice));
        assertEquals(1, listed.size());
        assertEquals("t1", listed.get(0).getEncryptedTitle());

        clock.advance(Duration.ofMinutes(5));
        Response updated = resource.update(alice, id, new EntryRequest("t2", "c2"));
        assertEquals(200, updated.getStatus());

        EntryView after = entities(resource.list(alice)).get(0);
        assertEquals("t2", after.getEncryptedTitle());
        assertEquals("c2", after.getEncryptedContent());
        assertEquals("2024-05-01 10:00:00", after.getDateCreated());
        assertEquals("2024-05-01 10:05:00", after.getDateModified());

        assertEquals(200, resource.delete(alice, id).getStatus());
        assertTrue(entities(resource.list(alice)).isEmpty());
    }

    @Test
    void otherUsersCannotTouchEntries() {
        users.register("a@x.com", "pw");
        users.register("b@x.com", "pw");
        SecurityContext alice = loginAs("a@x.com", "pw");
        SecurityContext bob = loginAs("b@x.com", "pw");

        long id = (Long) ((Map<?, ?>) resource.create(alice, new EntryRequest("t1", "c1")).getEntity()).get("id");

        assertTrue(entities(resource.list(bob)).isEmpty());
        assertEquals(403, resource.update(bob, id, new EntryRequest("x", "y")).getStatus());
        assertEquals(403, resource.delete(bob, id).getStatus());
        assertEquals(404, resource.delete(bob, id + 1000).getStatus());
        assertEquals("t1", entities(resource.list(alice)).get(0).getEncryptedTitle());
    }

    private SecurityContext loginAs(String email, String password) {
        UserAccount user = users.authenticate(email, password).orElseThrow();
        SecurityContext security = mock(SecurityContext.class);
        doReturn(new DiaryPrincipal(user.getId(), user.getEmail())).when(security).getUserPrincipal();
        return security;
    }

    @SuppressWarnings("unchecked")
    private static List<EntryView> entities(Response response) {
        assertEquals(200, response.getStatus());
        return (List<EntryView>) response.getEntity();
    }
}
