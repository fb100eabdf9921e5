package com.accesslist.api.rest;

import com.accesslist.core.model.*;
import com.accesslist.engine.service.AccessListService;
import com.accesslist.engine.service.AccessListService.UpsertAccessListRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * REST API for access lists.
 *
 * Single-list endpoints honour {@code If-Match}, {@code If-None-Match}, {@code If-Modified-Since}
 * and {@code If-Unmodified-Since} and answer with the list's version as ETag.
 */
@RestController
@RequestMapping("/api/v1")
public class AccessListController {

    private final AccessListService accessListService;

    public AccessListController(AccessListService accessListService) {
        this.accessListService = accessListService;
    }

    /**
     * List the access lists of a resource owner.
     */
    @GetMapping("/access-lists/{owner}")
    public ResponseEntity<PageResponse<AccessListResponse>> getAccessListsByOwner(
            @PathVariable String owner,
            @RequestParam(required = false) String token,
            @RequestParam(name = "include", required = false) Set<AccessListIncludes> include) {

        Page<AccessListInfo> page = accessListService.getAccessListsByOwner(owner, token, include);
        return ResponseEntity.ok(PageResponse.from(page, AccessListResponse::from));
    }

    /**
     * List the access lists a party is a member of.
     */
    @GetMapping("/memberships/{partyId}/access-lists")
    public ResponseEntity<List<AccessListResponse>> getAccessListsByMember(@PathVariable UUID partyId) {
        List<AccessListResponse> lists = accessListService.getAccessListsByMember(partyId).stream()
            .map(AccessListResponse::from)
            .toList();
        return ResponseEntity.ok(lists);
    }

    @GetMapping("/access-lists/{owner}/{identifier}")
    public ResponseEntity<AccessListResponse> getAccessList(
            @PathVariable String owner,
            @PathVariable String identifier,
            @RequestParam(name = "include", required = false) Set<AccessListIncludes> include,
            @RequestHeader HttpHeaders headers) {

        Conditional<AccessListInfo, Long> result = accessListService.getAccessList(
            owner, identifier, include, PreconditionHeaders.parse(headers, true));
        return toResponse(result, AccessListInfo::version, AccessListInfo::updatedAt, AccessListResponse::from);
    }

    /**
     * Create or update an access list. {@code If-None-Match: *} makes it create-only.
     */
    @PutMapping("/access-lists/{owner}/{identifier}")
    public ResponseEntity<AccessListResponse> upsertAccessList(
            @PathVariable String owner,
            @PathVariable String identifier,
            @RequestBody UpsertAccessListDto request,
            @RequestHeader HttpHeaders headers) {

        Conditional<AccessListInfo, Long> result = accessListService.createOrUpdateAccessList(
            new UpsertAccessListRequest(owner, identifier, request.name(), request.description()),
            PreconditionHeaders.parse(headers, false));
        return toResponse(result, AccessListInfo::version, AccessListInfo::updatedAt, AccessListResponse::from);
    }

    @DeleteMapping("/access-lists/{owner}/{identifier}")
    public ResponseEntity<AccessListResponse> deleteAccessList(
            @PathVariable String owner,
            @PathVariable String identifier,
            @RequestHeader HttpHeaders headers) {

        Conditional<AccessListInfo, Long> result = accessListService.deleteAccessList(
            owner, identifier, PreconditionHeaders.parse(headers, false));
        return toResponse(result, AccessListInfo::version, AccessListInfo::updatedAt, AccessListResponse::from);
    }

    // ========== Resource connections ==========

    @GetMapping("/access-lists/{owner}/{identifier}/resource-connections")
    public ResponseEntity<PageResponse<ResourceConnectionResponse>> getResourceConnections(
            @PathVariable String owner,
            @PathVariable String identifier,
            @RequestParam(required = false) String token,
            @RequestHeader HttpHeaders headers) {

        Conditional<AccessListData<Page<AccessListResourceConnection>>, Long> result =
            accessListService.getResourceConnections(owner, identifier, token, PreconditionHeaders.parse(headers, true));
        return toResponse(result, AccessListData::version, AccessListData::updatedAt,
            data -> PageResponse.from(data.value(), ResourceConnectionResponse::from));
    }

    @PutMapping("/access-lists/{owner}/{identifier}/resource-connections/{resourceIdentifier}")
    public ResponseEntity<ResourceConnectionResponse> upsertResourceConnection(
            @PathVariable String owner,
            @PathVariable String identifier,
            @PathVariable String resourceIdentifier,
            @RequestBody(required = false) ActionsDto request,
            @RequestHeader HttpHeaders headers) {

        Set<String> actions = request != null ? request.actions() : null;
        Conditional<AccessListData<AccessListResourceConnection>, Long> result = accessListService.upsertResourceConnection(
            owner, identifier, resourceIdentifier, actions, PreconditionHeaders.parse(headers, false));
        return toResponse(result, AccessListData::version, AccessListData::updatedAt,
            data -> ResourceConnectionResponse.from(data.value()));
    }

    @DeleteMapping("/access-lists/{owner}/{identifier}/resource-connections/{resourceIdentifier}")
    public ResponseEntity<ResourceConnectionResponse> deleteResourceConnection(
            @PathVariable String owner,
            @PathVariable String identifier,
            @PathVariable String resourceIdentifier,
            @RequestHeader HttpHeaders headers) {

        Conditional<AccessListData<AccessListResourceConnection>, Long> result = accessListService.deleteResourceConnection(
            owner, identifier, resourceIdentifier, PreconditionHeaders.parse(headers, false));
        return toResponse(result, AccessListData::version, AccessListData::updatedAt,
            data -> ResourceConnectionResponse.from(data.value()));
    }

    // ========== Members ==========

    @GetMapping("/access-lists/{owner}/{identifier}/members")
    public ResponseEntity<PageResponse<MembershipResponse>> getMembers(
            @PathVariable String owner,
            @PathVariable String identifier,
            @RequestParam(required = false) String token,
            @RequestHeader HttpHeaders headers) {

        Conditional<AccessListData<Page<AccessListMembership>>, Long> result =
            accessListService.getMembers(owner, identifier, token, PreconditionHeaders.parse(headers, true));
        return toResponse(result, AccessListData::version, AccessListData::updatedAt,
            data -> PageResponse.from(data.value(), MembershipResponse::from));
    }

    @PostMapping("/access-lists/{owner}/{identifier}/members")
    public ResponseEntity<List<MembershipResponse>> addMembers(
            @PathVariable String owner,
            @PathVariable String identifier,
            @RequestBody PartyIdsDto request,
            @RequestHeader HttpHeaders headers) {

        return toMembersResponse(accessListService.addMembers(
            owner, identifier, request.partyIds(), PreconditionHeaders.parse(headers, false)));
    }

    @PutMapping("/access-lists/{owner}/{identifier}/members")
    public ResponseEntity<List<MembershipResponse>> replaceMembers(
            @PathVariable String owner,
            @PathVariable String identifier,
            @RequestBody PartyIdsDto request,
            @RequestHeader HttpHeaders headers) {

        return toMembersResponse(accessListService.replaceMembers(
            owner, identifier, request.partyIds(), PreconditionHeaders.parse(headers, false)));
    }

    @DeleteMapping("/access-lists/{owner}/{identifier}/members")
    public ResponseEntity<List<MembershipResponse>> removeMembers(
            @PathVariable String owner,
            @PathVariable String identifier,
            @RequestBody PartyIdsDto request,
            @RequestHeader HttpHeaders headers) {

        return toMembersResponse(accessListService.removeMembers(
            owner, identifier, request.partyIds(), PreconditionHeaders.parse(headers, false)));
    }

    private ResponseEntity<List<MembershipResponse>> toMembersResponse(
            Conditional<AccessListData<List<AccessListMembership>>, Long> result) {
        return toResponse(result, AccessListData::version, AccessListData::updatedAt,
            data -> data.value().stream().map(MembershipResponse::from).toList());
    }

    /**
     * 200 with ETag, 304, 404 or 412.
     */
    static <T, B> ResponseEntity<B> toResponse(
            Conditional<T, Long> result,
            Function<T, Long> versionOf,
            Function<T, Instant> modifiedOf,
            Function<T, B> body) {
        return switch (result.kind()) {
            case FOUND -> ResponseEntity.ok()
                .eTag(PreconditionHeaders.etag(versionOf.apply(result.value())))
                .lastModified(modifiedOf.apply(result.value()))
                .body(body.apply(result.value()));
            case UNMODIFIED -> ResponseEntity.status(HttpStatus.NOT_MODIFIED)
                .eTag(PreconditionHeaders.etag(result.versionTag()))
                .lastModified(result.versionModifiedAt())
                .build();
            case NOT_FOUND -> ResponseEntity.notFound().build();
            case CONDITION_FAILED -> ResponseEntity.status(HttpStatus.PRECONDITION_FAILED).build();
        };
    }

    // ========== DTOs ==========

    public record UpsertAccessListDto(String name, String description) {}

    public record ActionsDto(Set<String> actions) {}

    public record PartyIdsDto(Set<UUID> partyIds) {}

    public record PageResponse<T>(List<T> items, String continuationToken) {
        public static <S, T> PageResponse<T> from(Page<S> page, Function<S, T> mapper) {
            return new PageResponse<>(page.items().stream().map(mapper).toList(), page.continuationToken());
        }
    }

    public record AccessListResponse(
        UUID id,
        String resourceOwner,
        String identifier,
        String name,
        String description,
        Instant createdAt,
        Instant updatedAt,
        List<ResourceConnectionResponse> resourceConnections,
        long version
    ) {
        public static AccessListResponse from(AccessListInfo info) {
            List<ResourceConnectionResponse> connections = info.resourceConnections() == null
                ? null
                : info.resourceConnections().stream().map(ResourceConnectionResponse::from).toList();
            return new AccessListResponse(
                info.id(),
                info.resourceOwner(),
                info.identifier(),
                info.name(),
                info.description(),
                info.createdAt(),
                info.updatedAt(),
                connections,
                info.version()
            );
        }
    }

    public record ResourceConnectionResponse(
        String resourceIdentifier,
        Set<String> actions,
        Instant createdAt,
        Instant modifiedAt
    ) {
        public static ResourceConnectionResponse from(AccessListResourceConnection connection) {
            return new ResourceConnectionResponse(
                connection.resourceIdentifier(),
                connection.actions(),
                connection.createdAt(),
                connection.modifiedAt()
            );
        }
    }

    public record MembershipResponse(UUID partyId, Instant since) {
        public static MembershipResponse from(AccessListMembership membership) {
            return new MembershipResponse(membership.partyId(), membership.since());
        }
    }
}
