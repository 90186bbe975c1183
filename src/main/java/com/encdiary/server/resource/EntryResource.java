package com.encdiary.server.resource;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.encdiary.server.dto.EntryRequest;
import com.encdiary.server.dto.EntryView;
import com.encdiary.server.error.EntryAccessDeniedException;
import com.encdiary.server.error.EntryNotFoundException;
import com.encdiary.server.error.StoreException;
import com.encdiary.server.error.ValidationException;
import com.encdiary.server.model.Entry;
import com.encdiary.server.security.DiaryPrincipal;
import com.encdiary.server.service.EntryService;

import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;

/**
 * CRUD over the caller's own diary entries. The caller comes from the
 * {@link SecurityContext} installed by the session filter.
 */
@Path("/entries")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
public class EntryResource {

    private static final Logger log = LoggerFactory.getLogger(EntryResource.class);

    private final EntryService entries;

    // CDI proxy
    EntryResource() {
        this(null);
    }

    @Inject
    public EntryResource(EntryService entries) {
        this.entries = entries;
    }

    @GET
    public Response list(@Context SecurityContext security) {
        Optional<DiaryPrincipal> caller = DiaryPrincipal.of(security);
        if (caller.isEmpty()) {
            return unauthorized();
        }
        try {
            List<EntryView> views = entries.list(caller.get().getUserId()).stream()
                    .map(EntryView::from)
                    .collect(Collectors.toList());
            return Response.ok(views).build();
        } catch (StoreException e) {
            return error(Response.Status.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Response create(@Context SecurityContext security, EntryRequest body) {
        Optional<DiaryPrincipal> caller = DiaryPrincipal.of(security);
        if (caller.isEmpty()) {
            return unauthorized();
        }
        try {
            Entry created = entries.create(caller.get().getUserId(), title(body), content(body));
            return Response.status(Response.Status.CREATED)
                    .entity(mutation("Entry created successfully.", created))
                    .build();
        } catch (ValidationException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        } catch (StoreException e) {
            return error(Response.Status.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @PUT
    @Path("/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response update(@Context SecurityContext security, @PathParam("id") long id, EntryRequest body) {
        Optional<DiaryPrincipal> caller = DiaryPrincipal.of(security);
        if (caller.isEmpty()) {
            return unauthorized();
        }
        try {
            Entry updated = entries.update(id, caller.get().getUserId(), title(body), content(body));
            return Response.ok(mutation("Entry updated successfully.", updated)).build();
        } catch (EntryNotFoundException e) {
            return error(Response.Status.NOT_FOUND, "Entry not found");
        } catch (EntryAccessDeniedException e) {
            return error(Response.Status.FORBIDDEN, "Unauthorized access");
        } catch (ValidationException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        } catch (StoreException e) {
            return error(Response.Status.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @DELETE
    @Path("/{id}")
    public Response delete(@Context SecurityContext security, @PathParam("id") long id) {
        Optional<DiaryPrincipal> caller = DiaryPrincipal.of(security);
        if (caller.isEmpty()) {
            return unauthorized();
        }
        try {
            entries.delete(id, caller.get().getUserId());
            return Response.ok(Map.of("message", "Entry deleted successfully.")).build();
        } catch (EntryNotFoundException e) {
            return error(Response.Status.NOT_FOUND, "Entry not found");
        } catch (EntryAccessDeniedException e) {
            return error(Response.Status.FORBIDDEN, "Unauthorized access");
        } catch (StoreException e) {
            return error(Response.Status.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private static Map<String, Object> mutation(String message, Entry entry) {
        return Map.of(
                "message", message,
                "id", entry.getId(),
                "date_modified", EntryView.format(entry.getDateModified()));
    }

    private static Response unauthorized() {
        log.warn("Entry API reached without an authenticated principal");
        return error(Response.Status.UNAUTHORIZED, "Authentication required.");
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status).entity(Map.of("error", message)).build();
    }

    private static String title(EntryRequest body) {
        return body == null ? null : body.encryptedTitle;
    }

    private static String content(EntryRequest body) {
        return body == null ? null : body.encryptedContent;
    }
}
