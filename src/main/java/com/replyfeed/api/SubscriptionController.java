package com.replyfeed.api;

import com.replyfeed.domain.model.Subscription;
import com.replyfeed.domain.service.SubscriptionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the requester's own subscriptions.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final RequesterResolver requesterResolver;

    @GetMapping
    public ResponseEntity<List<Subscription>> listSubscriptions(HttpServletRequest request) {
        return ResponseEntity.ok(subscriptionService.listSubscriptions(requester(request)));
    }

    /**
     * POST /api/v1/subscriptions
     * 
     * 201 when a subscription was created, 200 when it already existed.
     */
    @PostMapping
    public ResponseEntity<Void> subscribe(@Valid @RequestBody SubscribeRequest body, HttpServletRequest request) {
        boolean created = subscriptionService.subscribe(
                requester(request), body.getSubscribedPostUri().trim(), body.getSubscriptionPostRkey());
        return ResponseEntity.status(created ? HttpStatus.CREATED : HttpStatus.OK).build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> unsubscribe(@PathVariable("id") long id, HttpServletRequest request) {
        subscriptionService.unsubscribe(requester(request), id);
        return ResponseEntity.noContent().build();
    }

    private String requester(HttpServletRequest request) {
        return requesterResolver.resolve(request).orElseThrow(MissingRequesterException::new);
    }
}
