package com.jz.moderation.admission;

import com.jz.moderation.domain.entity.ChallengeDifficulty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * 算术验证题。
 * easy:   a+b，a,b∈[1,9]，选项范围 [2,18]
 * medium: a+b，a∈[10,30]，b∈[1,20]，选项范围 [11,50]
 * hard:   a×b，a∈[10,30]，b∈[2,9]，选项范围 [20,270]
 */
public class ChallengeGenerator {

    private static final int NEAR_ATTEMPTS = 100;

    private final Random random;
    private final int optionCount;

    public ChallengeGenerator(Random random, int optionCount) {
        this.random = random;
        this.optionCount = Math.max(2, optionCount);
    }

    public ChallengeQuestion generate(ChallengeDifficulty difficulty) {
        int a, b, answer, min, max;
        String op;
        switch (difficulty) {
            case MEDIUM -> {
                a = between(10, 30);
                b = between(1, 20);
                answer = a + b;
                op = "+";
                min = 11;
                max = 50;
            }
            case HARD -> {
                a = between(10, 30);
                b = between(2, 9);
                answer = a * b;
                op = "×";
                min = 20;
                max = 270;
            }
            default -> {
                a = between(1, 9);
                b = between(1, 9);
                answer = a + b;
                op = "+";
                min = 2;
                max = 18;
            }
        }
        String question = a + " " + op + " " + b + " = ?";
        return new ChallengeQuestion(question, String.valueOf(answer), options(answer, min, max));
    }

    /** 先在答案 ±30% 内找干扰项，凑不够再在整个范围里随机补 */
    List<String> options(int answer, int min, int max) {
        Set<Integer> picked = new LinkedHashSet<>();
        picked.add(answer);

        int delta = Math.max(1, (int) (answer * 0.3));
        for (int i = 0; i < NEAR_ATTEMPTS && picked.size() < optionCount; i++) {
            int candidate = answer + between(-delta, delta);
            if (candidate >= min && candidate <= max) picked.add(candidate);
        }
        while (picked.size() < optionCount) {
            picked.add(between(min, max));
        }

        List<String> out = new ArrayList<>(picked.size());
        for (Integer v : picked) out.add(String.valueOf(v));
        Collections.shuffle(out, random);
        return out;
    }

    private int between(int lo, int hi) {
        return lo + random.nextInt(hi - lo + 1);
    }
}
