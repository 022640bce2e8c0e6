package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

import java.util.List;

/**
 * Reverse DNS names of the remote IP, split by how forward lookups confirmed them.
 *
 * @param verified     names whose forward lookup includes the remote IP
 * @param noForward    names with no forward addresses at all
 * @param inconsistent names whose forward addresses do not include the remote IP
 */
public record RemoteDns(List<String> verified, List<String> noForward, List<String> inconsistent) {

    public RemoteDns {
        verified = verified == null ? List.of() : List.copyOf(verified);
        noForward = noForward == null ? List.of() : List.copyOf(noForward);
        inconsistent = inconsistent == null ? List.of() : List.copyOf(inconsistent);
    }

    public static RemoteDns empty() {
        return new RemoteDns(List.of(), List.of(), List.of());
    }
}
