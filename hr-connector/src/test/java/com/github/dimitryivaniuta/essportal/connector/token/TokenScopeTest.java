package com.github.dimitryivaniuta.essportal.connector.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dimitryivaniuta.essportal.common.error.ErrorKind;
import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import org.junit.jupiter.api.Test;

class TokenScopeTest {

    @Test
    void emptyScopeGrantsEveryKind() {
        TokenScope scope = TokenScope.parse("  ");

        assertThat(scope.isUnrestricted()).isTrue();
        for (ResourceKind kind : ResourceKind.values()) {
            assertThat(scope.permits(kind)).as(kind.tag()).isTrue();
        }
    }

    @Test
    void leaveScopeDeniesPayslips() {
        TokenScope scope = TokenScope.parse("hr.leave");

        assertThat(scope.permits(ResourceKind.LEAVE)).isTrue();
        assertThat(scope.permits(ResourceKind.PAYSLIP)).isFalse();
        assertThat(scope.permits(ResourceKind.LEAVE_TYPE)).isFalse();
    }

    @Test
    void operationsWithoutKindArePermittedForAnyScope() {
        assertThat(TokenScope.parse("hr.expense").permits(null)).isTrue();
    }

    @Test
    void parseTrimsAndIgnoresEmptySegments() {
        TokenScope scope = TokenScope.parse(" hr.payslip , ,hr.leave ");

        assertThat(scope.kinds()).containsExactlyInAnyOrder(ResourceKind.PAYSLIP, ResourceKind.LEAVE);
        assertThat(scope.toColumnValue()).isEqualTo("hr.leave,hr.payslip");
    }

    @Test
    void unknownTagIsRejected() {
        assertThatThrownBy(() -> TokenScope.parse("hr.leave,hr.salary"))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).getKind()).isEqualTo(ErrorKind.VALIDATION))
                .hasMessageContaining("hr.salary");
    }

    @Test
    void columnValueParsesBackToEqualScope() {
        TokenScope scope = TokenScope.parse("ir.attachment,hr.attendance");

        assertThat(TokenScope.parse(scope.toColumnValue())).isEqualTo(scope);
        assertThat(TokenScope.unrestricted().toColumnValue()).isEmpty();
    }
}
