package com.kmg.dms.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CodePayloadTest {

    @Test
    void parsesTaggedPayload() {
        String raw = "DDLGA;MD1;PN1;UNjane.doe;ED01.12.2025;ES12/2025;YR2025";

        Map<String, String> fields = CodePayload.parseFields(raw);

        assertThat(CodePayload.parseSubjectId(raw)).isEqualTo("1");
        assertThat(CodePayload.tenantHint(raw)).isEqualTo("1");
        assertThat(fields)
                .containsEntry("subject_id", "1")
                .containsEntry("tenant_hint", "1")
                .containsEntry("username", "jane.doe")
                .containsEntry("effective_date", "01.12.2025")
                .containsEntry("period", "12/2025")
                .containsEntry("year", "2025");
    }

    @Test
    void parsesLegacyLayouts() {
        assertThat(CodePayload.parseSubjectId("PN10")).isEqualTo("10");
        assertThat(CodePayload.parseSubjectId("12345")).isEqualTo("12345");
        assertThat(CodePayload.parseSubjectId("Personalnummer: 4711")).isEqualTo("4711");
        assertThat(CodePayload.parseSubjectId("^1008=00042^")).isEqualTo("00042");
    }

    @Test
    void payloadWithoutSubjectYieldsNull() {
        assertThat(CodePayload.parseSubjectId(null)).isNull();
        assertThat(CodePayload.parseSubjectId("   ")).isNull();
        assertThat(CodePayload.parseSubjectId("hello world")).isNull();
        assertThat(CodePayload.tenantHint("PN5")).isNull();
    }
}
