package ai.advisory.proposal;

import java.util.Optional;

/**
 * What {@link ProposalExtractor#inspect(String)} found in a reply.
 */
public record Extraction(
        Kind kind,
        TradeProposal proposal,
        String reason
) {
    public enum Kind {
        /** No structured block in the reply. */
        NONE,
        PROPOSAL,
        /** A block was present but could not be parsed or failed validation. */
        INVALID
    }

    static final Extraction NONE_FOUND = new Extraction(Kind.NONE, null, null);

    static Extraction of(TradeProposal proposal) {
        return new Extraction(Kind.PROPOSAL, proposal, null);
    }

    static Extraction invalid(String reason) {
        return new Extraction(Kind.INVALID, null, reason);
    }

    public Optional<TradeProposal> asOptional() {
        return Optional.ofNullable(proposal);
    }
}
