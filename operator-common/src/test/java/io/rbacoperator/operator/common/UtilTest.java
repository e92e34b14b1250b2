/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;

public class UtilTest {
    @Test
    public void testHashStub() {
        // SHA-1 of "abc" is a9993e364706816aba3e25717850c26c9cd0d89d
        assertThat(Util.hashStub("abc"), is("a9993e36"));
        assertThat(Util.hashStub("abc").length(), is(Util.HASH_STUB_LENGTH));
        assertThat(Util.hashStub("abd"), is(not(Util.hashStub("abc"))));
    }

    @Test
    public void testHashStubIsStable() {
        assertThat(Util.hashStub("my-rule-devs-clusterrole-edit"), is(Util.hashStub("my-rule-devs-clusterrole-edit")));
    }
}
