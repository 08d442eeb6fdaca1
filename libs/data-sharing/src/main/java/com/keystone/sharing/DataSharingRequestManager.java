package com.keystone.sharing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import static com.keystone.sharing.InvalidRequestTransitionException.Reason.ALREADY_DECIDED;
import static com.keystone.sharing.InvalidRequestTransitionException.Reason.NOT_APPROVED;
import static com.keystone.sharing.InvalidRequestTransitionException.Reason.NOT_OWNER;
import static com.keystone.sharing.InvalidRequestTransitionException.Reason.NOT_REQUESTER;

/**
 * Runs the data sharing request lifecycle.
 * <pre>
 *   create ──► PENDING ──approve (owner)──► APPROVED ──resolve (requester)──► request key
 *                 │
 *                 ├──reject (owner)──► REJECTED
 *                 └──expiry passes───► EXPIRED
 * </pre>
 * Approving an approved request or rejecting a rejected one returns it unchanged. Every other
 * move out of a terminal state, and every action by the wrong party, raises
 * {@link InvalidRequestTransitionException}. Transitions are a compare-and-set in the store,
 * so concurrent approve and reject calls settle on exactly one outcome.
 * <p>
 * The request key alone does not open a sealed field: the inner layer still needs the
 * owner's token.
 */
public class DataSharingRequestManager {

    private static final Logger log = LoggerFactory.getLogger(DataSharingRequestManager.class);

    public static final Duration DEFAULT_REQUEST_TTL = Duration.ofDays(30);

    private static final Comparator<SharingRequest> NEWEST_FIRST = Comparator
            .comparing(SharingRequest::createdAt)
            .thenComparing(SharingRequest::requestId)
            .reversed();

    private final SharingRequestStore store;
    private final RequestKeyGenerator keys;
    private final Clock clock;
    private final Duration requestTtl;

    public DataSharingRequestManager(SharingRequestStore store, Clock clock) {
        this(store, new RequestKeyGenerator(), clock, DEFAULT_REQUEST_TTL);
    }

    public DataSharingRequestManager(SharingRequestStore store, RequestKeyGenerator keys, Clock clock,
                                     Duration requestTtl) {
        if (store == null || keys == null || clock == null) {
            throw new IllegalArgumentException("store, keys and clock must not be null");
        }
        if (requestTtl == null || requestTtl.isNegative() || requestTtl.isZero()) {
            throw new IllegalArgumentException("requestTtl must be positive");
        }
        this.store = store;
        this.keys = keys;
        this.clock = clock;
        this.requestTtl = requestTtl;
    }

    /**
     * Opens a pending request with a fresh request key.
     */
    public SharingRequestView create(String ownerId, String requesterId, String dataType, String reason) {
        Instant now = clock.instant();
        SharingRequest request = new SharingRequest(
                keys.newRequestId(now),
                ownerId,
                requesterId,
                keys.newRequestKey(),
                SharingStatus.PENDING,
                dataType,
                reason,
                now,
                null,
                now.plus(requestTtl));
        store.insert(request);
        log.info("Sharing request {} opened by {} for {} data of {}",
                request.requestId(), requesterId, dataType, ownerId);
        return SharingRequestView.of(request, now);
    }

    public SharingRequestView approve(String requestId, String actingParty) {
        return decide(requestId, actingParty, SharingStatus.APPROVED);
    }

    public SharingRequestView reject(String requestId, String actingParty) {
        return decide(requestId, actingParty, SharingStatus.REJECTED);
    }

    /**
     * Releases the request key to the requester of an approved request.
     *
     * @throws SharingRequestNotFoundException    if the id is unknown
     * @throws InvalidRequestTransitionException if the caller is not the requester or the
     *                                            request is not approved
     */
    public String resolve(String requestId, String requester) {
        SharingRequest request = load(requestId);
        SharingStatus status = request.statusAt(clock.instant());
        if (!request.requesterId().equals(requester)) {
            log.warn("Party {} tried to resolve sharing request {} it did not open", requester, requestId);
            throw new InvalidRequestTransitionException(requestId, status, NOT_REQUESTER);
        }
        if (status != SharingStatus.APPROVED) {
            throw new InvalidRequestTransitionException(requestId, status, NOT_APPROVED);
        }
        return request.requestKey();
    }

    /**
     * The request key of an approved request, for the owner sealing data for the requester.
     *
     * @throws InvalidRequestTransitionException if the caller is not the owner or the request
     *                                            is not approved
     */
    public String sealingKey(String requestId, String owner) {
        SharingRequest request = load(requestId);
        SharingStatus status = request.statusAt(clock.instant());
        if (!request.ownerId().equals(owner)) {
            throw new InvalidRequestTransitionException(requestId, status, NOT_OWNER);
        }
        if (status != SharingStatus.APPROVED) {
            throw new InvalidRequestTransitionException(requestId, status, NOT_APPROVED);
        }
        return request.requestKey();
    }

    public SharingRequestView get(String requestId) {
        return SharingRequestView.of(load(requestId), clock.instant());
    }

    /**
     * Like {@link #get} but only for the owner or the requester. Anyone else is told the
     * request does not exist.
     */
    public SharingRequestView getAs(String requestId, String party) {
        SharingRequest request = load(requestId);
        if (!request.isParty(party)) {
            throw new SharingRequestNotFoundException(requestId);
        }
        return SharingRequestView.of(request, clock.instant());
    }

    /** Requests targeting {@code ownerId}, newest first. */
    public List<SharingRequestView> listForOwner(String ownerId) {
        return views(store.findByOwner(ownerId));
    }

    /** Requests opened by {@code requesterId}, newest first. */
    public List<SharingRequestView> listForRequester(String requesterId) {
        return views(store.findByRequester(requesterId));
    }

    private SharingRequestView decide(String requestId, String actingParty, SharingStatus target) {
        while (true) {
            SharingRequest current = load(requestId);
            Instant now = clock.instant();
            SharingStatus status = current.statusAt(now);
            if (!current.ownerId().equals(actingParty)) {
                log.warn("Party {} tried to {} sharing request {} owned by {}",
                        actingParty, target, requestId, current.ownerId());
                throw new InvalidRequestTransitionException(requestId, status, NOT_OWNER);
            }
            if (status == target) {
                return SharingRequestView.of(current, now);
            }
            if (status.isTerminal()) {
                throw new InvalidRequestTransitionException(requestId, status, ALREADY_DECIDED);
            }
            var swapped = store.compareAndSetStatus(requestId, SharingStatus.PENDING, target, now);
            if (swapped.isPresent()) {
                log.info("Sharing request {} {} by owner", requestId, target);
                return SharingRequestView.of(swapped.get(), now);
            }
            // lost a race with another decision, re-read and report against the winner
        }
    }

    private SharingRequest load(String requestId) {
        return store.find(requestId).orElseThrow(() -> new SharingRequestNotFoundException(requestId));
    }

    private List<SharingRequestView> views(List<SharingRequest> requests) {
        Instant now = clock.instant();
        return requests.stream()
                .sorted(NEWEST_FIRST)
                .map(r -> SharingRequestView.of(r, now))
                .toList();
    }
}
