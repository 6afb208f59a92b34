package tech.lapse.platform.oauth;

import tech.lapse.platform.authorization.ScopeDefinition;
import tech.lapse.platform.serviceclient.ServiceClientView;

import java.util.List;

/**
 * Where a consent request ended up.
 */
public sealed interface ConsentOutcome permits
        ConsentOutcome.AutoReissued,
        ConsentOutcome.AwaitingDecision,
        ConsentOutcome.Approved,
        ConsentOutcome.Denied {

    ConsentState state();

    /**
     * An active grant already covered the client; a fresh token was issued
     * without asking the user again.
     */
    record AutoReissued(String redirectUrl, String accessToken, String grantId) implements ConsentOutcome {
        @Override
        public ConsentState state() {
            return ConsentState.AUTO_REISSUE;
        }
    }

    /**
     * No active grant; the user has to decide. Carries what the consent
     * screen shows.
     */
    record AwaitingDecision(ServiceClientView client, List<ScopeDefinition> requestedScopes) implements ConsentOutcome {
        @Override
        public ConsentState state() {
            return ConsentState.AWAITING_DECISION;
        }
    }

    record Approved(String redirectUrl, String accessToken, String grantId) implements ConsentOutcome {
        @Override
        public ConsentState state() {
            return ConsentState.APPROVED;
        }
    }

    record Denied(String redirectUrl) implements ConsentOutcome {
        @Override
        public ConsentState state() {
            return ConsentState.DENIED;
        }
    }
}
