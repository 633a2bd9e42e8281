package ai.advisory.api;

import ai.advisory.api.model.AdvisorView;
import ai.advisory.api.model.AskRequest;
import ai.advisory.api.model.RoundResponse;
import ai.advisory.api.model.SessionResponse;
import ai.advisory.config.AdvisoryProperties;
import ai.advisory.conversation.Message;
import ai.advisory.proposal.TradeProposal;
import ai.advisory.service.AdvisoryService;
import ai.advisory.service.AdvisorySession;
import ai.advisory.service.AdvisorySessions;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/ai/advisory/sessions")
public class AdvisoryController {
    private final AdvisorySessions sessions;
    private final AdvisoryService service;

    public AdvisoryController(AdvisorySessions sessions, AdvisoryService service) {
        this.sessions = sessions;
        this.service = service;
    }

    @PostMapping
    public ResponseEntity<SessionResponse> open() {
        return ResponseEntity.ok(describe(sessions.open()));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> get(@PathVariable String sessionId) {
        return ResponseEntity.ok(describe(sessions.require(sessionId)));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> close(@PathVariable String sessionId) {
        sessions.close(sessionId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{sessionId}/advisors")
    public ResponseEntity<AdvisorView> register(
            @PathVariable String sessionId,
            @RequestBody AdvisoryProperties.Advisor advisor
    ) {
        return ResponseEntity.ok(AdvisorView.from(sessions.register(sessionId, advisor)));
    }

    @PostMapping("/{sessionId}/rounds")
    public ResponseEntity<RoundResponse> askAll(@PathVariable String sessionId, @RequestBody AskRequest request) {
        return ResponseEntity.ok(RoundResponse.from(
                sessionId,
                service.askAll(sessionId, request.toContext(), request.question())
        ));
    }

    @PostMapping("/{sessionId}/advisors/{advisor}/rounds")
    public ResponseEntity<RoundResponse> askOne(
            @PathVariable String sessionId,
            @PathVariable String advisor,
            @RequestBody AskRequest request
    ) {
        return ResponseEntity.ok(RoundResponse.from(
                sessionId,
                service.askOne(sessionId, advisor, request.toContext(), request.question())
        ));
    }

    @GetMapping("/{sessionId}/advisors/{advisor}/history")
    public ResponseEntity<List<Message>> history(@PathVariable String sessionId, @PathVariable String advisor) {
        return ResponseEntity.ok(service.history(sessionId, advisor));
    }

    @DeleteMapping("/{sessionId}/advisors/{advisor}/history")
    public ResponseEntity<Void> reset(@PathVariable String sessionId, @PathVariable String advisor) {
        service.reset(sessionId, advisor);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{sessionId}/history")
    public ResponseEntity<Void> resetAll(@PathVariable String sessionId) {
        service.resetAll(sessionId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sessionId}/advisors/{advisor}/proposal/submit")
    public ResponseEntity<TradeProposal> submitProposal(@PathVariable String sessionId, @PathVariable String advisor) {
        return ResponseEntity.ok(service.submitProposal(sessionId, advisor));
    }

    private static SessionResponse describe(AdvisorySession session) {
        return new SessionResponse(
                session.id(),
                session.openedAt(),
                session.orchestrator().advisors().stream().map(AdvisorView::from).toList()
        );
    }
}
