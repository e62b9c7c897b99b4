package com.openforge.numen.contract;

import java.util.List;

/**
 * Contract fixtures shared by the tests.
 */
public final class TestContracts {

    private TestContracts() {}

    public static AgentContract.AgentContractBuilder draft() {
        return AgentContract.builder()
                .tenantId("T")
                .ownerId("owner-1")
                .name("Sage")
                .type(AgentType.CONVERSATIONAL)
                .tags(List.of("coach"))
                .identity(AgentIdentity.builder()
                        .shortDescription("A calm mentor")
                        .characterRole("Mentor")
                        .mission("Help the user think clearly")
                        .interactionStyle("Socratic")
                        .build());
    }

    public static AgentContract withTraits(AgentTraits traits) {
        return draft().traits(traits).build();
    }
}
