package com.formatrouter.split;

import com.formatrouter.model.FormatToken;
import com.formatrouter.model.Role;
import com.formatrouter.testutil.Source;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.formatrouter.testutil.TreeDsl.name;
import static com.formatrouter.testutil.TreeDsl.source;
import static org.junit.jupiter.api.Assertions.*;

class PolicyTest {

    private Source src;
    private FormatToken ab;
    private FormatToken bc;
    private FormatToken cEof;

    @BeforeEach
    void setUp() {
        // a, b and c on lines of their own
        src = source(name(Role.STAT, "a"), name(Role.STAT, "b"), name(Role.STAT, "c"));
        ab = src.pair("a", "b");
        bc = src.pair("b", "c");
        cEof = src.after(src.token("c"));
    }

    private static List<Split> spaceOrNewline() {
        return List.of(new Split(Modification.SPACE, 0), new Split(Modification.NEWLINE, 1));
    }

    private static Policy killNewlines(int expire) {
        return Policy.of(expire, "NoNewlines", Decision::noNewlines);
    }

    @Test
    @DisplayName("A policy leaves pairs after its expiry untouched")
    void testOutsideRange() {
        Policy policy = Policy.of(src.token("b"), "NoNewlines", Decision::noNewlines);

        assertEquals(1, policy.apply(new Decision(ab, spaceOrNewline())).size());
        assertEquals(spaceOrNewline(), policy.apply(new Decision(cEof, spaceOrNewline())));
    }

    @Test
    @DisplayName("The pair right after the expire token is still covered")
    void testExpireIsInclusive() {
        Policy policy = Policy.of(src.token("b"), "NoNewlines", Decision::noNewlines);

        assertTrue(policy.appliesTo(bc));
        List<Split> result = policy.apply(new Decision(bc, spaceOrNewline()));
        assertEquals(1, result.size());
        assertFalse(result.get(0).isNewline());
    }

    @Test
    @DisplayName("A rule without an opinion keeps the candidates")
    void testNoOpinion() {
        Policy policy = Policy.of(src.token("c"), "Silent", d -> null);
        List<Split> splits = spaceOrNewline();

        assertEquals(splits, policy.apply(new Decision(ab, splits)));
    }

    @Test
    @DisplayName("A rule cannot add a kind of modification the pair did not offer")
    void testMonotoneNarrowing() {
        Policy widening = Policy.of(src.token("c"), "Widen",
                d -> List.of(new Split(Modification.NEWLINE, 0), new Split(Modification.NO_SPLIT, 3)));
        List<Split> result = widening.apply(new Decision(ab, List.of(new Split(Modification.NO_SPLIT, 0))));

        assertEquals(1, result.size());
        assertEquals(Modification.NO_SPLIT, result.get(0).getModification());
        assertEquals(3, result.get(0).getCost());
    }

    @Test
    @DisplayName("A rule may reprice and may leave no candidate at all")
    void testRepriceAndKill() {
        Policy penalize = Policy.of(src.token("c"), "Penalize", d -> d.withPenalty(5, true));
        Policy kill = Policy.of(src.token("c"), "Kill", d -> List.of());

        List<Split> repriced = penalize.apply(new Decision(ab, spaceOrNewline()));
        assertEquals(0, repriced.get(0).getCost());
        assertEquals(6, repriced.get(1).getCost());
        assertTrue(kill.apply(new Decision(ab, spaceOrNewline())).isEmpty());
    }

    @Test
    @DisplayName("A forced line break never lets a space through")
    void testForcedNewlineOnSpaceOnlyPair() {
        Split fallback = new Split(Modification.NEWLINE, 0);
        Policy force = Policy.of(src.token("c"), "ForceNewline", d -> d.onlyNewlinesWithFallback(fallback));
        Decision spaceOnly = new Decision(ab, List.of(new Split(Modification.SPACE, 0)));

        assertEquals(List.of(fallback), spaceOnly.onlyNewlinesWithFallback(fallback));
        assertTrue(force.apply(spaceOnly).isEmpty());

        List<Split> offered = force.apply(new Decision(ab, spaceOrNewline()));
        assertEquals(1, offered.size());
        assertTrue(offered.get(0).isNewline());
        assertEquals(0, offered.get(0).getCost());
    }

    @Test
    @DisplayName("andThen feeds the first verdict to the second policy")
    void testAndThen() {
        Policy onlyNewlines = Policy.of(src.token("c"), "OnlyNewlines", Decision::onlyNewlinesWithoutFallback);
        Policy penalize = Policy.of(src.token("c"), "Penalize", d -> d.withPenalty(2, false));

        List<Split> result = onlyNewlines.andThen(penalize).apply(new Decision(ab, spaceOrNewline()));

        assertEquals(1, result.size());
        assertTrue(result.get(0).isNewline());
        assertEquals(3, result.get(0).getCost());
    }

    @Test
    @DisplayName("Each part of a composed policy keeps its own range")
    void testComposedRanges() {
        Policy shortLived = killNewlines(src.token("a").getEnd());
        Policy penalize = Policy.of(src.token("c"), "Penalize", d -> d.withPenalty(1, true));
        Policy composed = shortLived.andThen(penalize);

        assertEquals(src.token("c").getEnd(), composed.getExpire());
        List<Split> atAb = composed.apply(new Decision(ab, spaceOrNewline()));
        assertEquals(1, atAb.size());
        assertFalse(atAb.get(0).isNewline());
        assertEquals(0, atAb.get(0).getCost());

        // "a" has expired: only the penalty applies
        List<Split> atBc = composed.apply(new Decision(bc, spaceOrNewline()));
        assertEquals(2, atBc.size());
        assertEquals(2, atBc.get(1).getCost());
    }

    @Test
    @DisplayName("orElse falls back only where the first policy has no verdict")
    void testOrElse() {
        Policy onlyAtB = Policy.of(src.token("c"), "OnlyAtB",
                d -> d.getFormatToken().getRight().isIdent("b") ? d.noNewlines() : null);
        Policy fallback = Policy.of(src.token("c"), "Fallback", Decision::onlyNewlinesWithoutFallback);
        Policy policy = onlyAtB.orElse(fallback);

        assertFalse(policy.apply(new Decision(ab, spaceOrNewline())).get(0).isNewline());
        List<Split> atBc = policy.apply(new Decision(bc, spaceOrNewline()));
        assertEquals(1, atBc.size());
        assertTrue(atBc.get(0).isNewline());
    }

    @Test
    @DisplayName("Composing with the empty policy is the identity")
    void testEmptyPolicy() {
        Policy policy = killNewlines(10);

        assertTrue(Policy.NO_POLICY.isEmpty());
        assertSame(policy, policy.andThen(Policy.NO_POLICY));
        assertSame(policy, Policy.NO_POLICY.andThen(policy));
        assertSame(policy, policy.orElse(Policy.NO_POLICY));
        assertEquals(spaceOrNewline(), Policy.NO_POLICY.apply(new Decision(ab, spaceOrNewline())));
    }

    @Test
    @DisplayName("Policies built from the same description and expiry are equal")
    void testEquality() {
        assertEquals(killNewlines(7), killNewlines(7));
        assertEquals(killNewlines(7).hashCode(), killNewlines(7).hashCode());
        assertNotEquals(killNewlines(7), killNewlines(8));
    }
}
