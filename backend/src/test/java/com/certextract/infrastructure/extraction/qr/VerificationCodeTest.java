package com.certextract.infrastructure.extraction.qr;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationCodeTest {

    @Test
    void recognises_gas_safe_register_links() {
        VerificationCode code = VerificationCode.parse("https://www.gassaferegister.co.uk/check/123456");

        assertThat(code.provider()).isEqualTo(VerificationCode.Provider.GAS_SAFE);
        assertThat(code.code()).isEqualTo("123456");
        assertThat(code.url()).isEqualTo("https://www.gassaferegister.co.uk/check/123456");
    }

    @Test
    void recognises_gas_tag_and_niceic() {
        assertThat(VerificationCode.parse("https://gastag.co.uk/verify/GT-77A").code()).isEqualTo("GT-77A");
        assertThat(VerificationCode.parse("https://niceic.com/verify/N998").provider())
                .isEqualTo(VerificationCode.Provider.NICEIC);
    }

    @Test
    void corgi_links_carry_no_code() {
        VerificationCode code = VerificationCode.parse("https://corgihomeplan.co.uk/verify?id=1");

        assertThat(code.provider()).isEqualTo(VerificationCode.Provider.CORGI);
        assertThat(code.code()).isNull();
    }

    @Test
    void unknown_payloads_are_other() {
        VerificationCode code = VerificationCode.parse("ASSET-4471");

        assertThat(code.provider()).isEqualTo(VerificationCode.Provider.OTHER);
        assertThat(code.url()).isNull();
    }
}
