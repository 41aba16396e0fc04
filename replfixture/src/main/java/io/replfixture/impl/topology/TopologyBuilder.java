/*
 * Copyright (c) 2026, ReplFixture.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.replfixture.impl.topology;

import io.replfixture.model.MemberDescriptor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static io.replfixture.model.MemberDescriptor.hiddenMember;
import static io.replfixture.model.MemberDescriptor.member;
import static java.util.Objects.requireNonNull;

/**
 * Computes the member list of a replica set from the hosts of its nodes.
 * <p>
 * The first member is always electable and voting. The remaining members
 * are electable only if all nodes are electable, and voting only if
 * secondaries vote and the voting ceiling is not reached yet. Surplus
 * voters are demoted to non-voting members. The hidden initial sync member,
 * if requested, is appended last and never votes or becomes primary.
 */
public final class TopologyBuilder {

    /**
     * Maximum number of voting members a replica set can have.
     */
    public static final int MAX_VOTING_MEMBERS = 7;

    private TopologyBuilder() {
    }

    /**
     * Builds the member list.
     *
     * @param hosts
     *         internal addresses of the regular nodes, ordered by index
     * @param allNodesElectable
     *         whether every regular node can become primary
     * @param votingSecondaries
     *         whether the secondaries vote in elections
     * @param hiddenHost
     *         internal address of the hidden initial sync member, or null
     *
     * @return the member list, ordered by member id
     */
    @Nonnull
    public static List<MemberDescriptor> buildMembers(@Nonnull List<String> hosts, boolean allNodesElectable,
                                                      boolean votingSecondaries, @Nullable String hiddenHost) {
        requireNonNull(hosts);
        if (hosts.isEmpty()) {
            throw new IllegalArgumentException("Cannot build replica set members without hosts!");
        }

        List<MemberDescriptor> members = new ArrayList<>(hosts.size() + 1);
        members.add(member(0, hosts.get(0), true, true));
        for (int i = 1; i < hosts.size(); i++) {
            boolean voting = votingSecondaries && i < MAX_VOTING_MEMBERS;
            members.add(member(i, hosts.get(i), allNodesElectable, voting));
        }

        if (hiddenHost != null) {
            members.add(hiddenMember(hosts.size(), hiddenHost));
        }

        return members;
    }

}
