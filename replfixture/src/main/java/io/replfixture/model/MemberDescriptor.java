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

package io.replfixture.model;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Describes a single member of a replica set configuration.
 * <p>
 * A member that is not electable is sent with priority 0. The priority of
 * an electable member is left to the server default. A hidden member is
 * never electable and never votes.
 */
public final class MemberDescriptor {

    private final int id;
    private final String host;
    private final boolean electable;
    private final boolean voting;
    private final boolean hidden;

    private MemberDescriptor(int id, String host, boolean electable, boolean voting, boolean hidden) {
        if (id < 0) {
            throw new IllegalArgumentException("member id cannot be negative: " + id);
        }

        this.id = id;
        this.host = requireNonNull(host);
        this.electable = electable;
        this.voting = voting;
        this.hidden = hidden;
    }

    /**
     * Creates a descriptor of a regular (non-hidden) member.
     *
     * @param id
     *         the member id
     * @param host
     *         the "host:port" string of the member
     * @param electable
     *         whether the member can become primary
     * @param voting
     *         whether the member votes in elections
     *
     * @return the created descriptor
     */
    @Nonnull
    public static MemberDescriptor member(int id, @Nonnull String host, boolean electable, boolean voting) {
        return new MemberDescriptor(id, host, electable, voting, false);
    }

    /**
     * Creates a descriptor of a hidden member that only receives a copy of
     * the data. It has priority 0 and no vote.
     *
     * @param id
     *         the member id
     * @param host
     *         the "host:port" string of the member
     *
     * @return the created descriptor
     */
    @Nonnull
    public static MemberDescriptor hiddenMember(int id, @Nonnull String host) {
        return new MemberDescriptor(id, host, false, false, true);
    }

    public int getId() {
        return id;
    }

    @Nonnull
    public String getHost() {
        return host;
    }

    public boolean isElectable() {
        return electable;
    }

    public boolean isVoting() {
        return voting;
    }

    public boolean isHidden() {
        return hidden;
    }

    public int getPriority() {
        return electable ? 1 : 0;
    }

    public int getVotes() {
        return voting ? 1 : 0;
    }

    /**
     * Returns the member document sent in replica set initiate and
     * reconfigure commands.
     *
     * @return the member document
     */
    @Nonnull
    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("_id", id);
        document.put("host", host);
        if (!electable) {
            document.put("priority", 0);
        }
        if (hidden) {
            document.put("hidden", 1);
        }
        if (!voting) {
            document.put("votes", 0);
        }

        return document;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        MemberDescriptor that = (MemberDescriptor) o;
        return id == that.id && electable == that.electable && voting == that.voting && hidden == that.hidden
               && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, host, electable, voting, hidden);
    }

    @Override
    public String toString() {
        return "MemberDescriptor{" + "id=" + id + ", host='" + host + '\'' + ", priority=" + getPriority() + ", votes="
               + getVotes() + ", hidden=" + hidden + '}';
    }

}
