package com.jz.moderation.admission;

import java.util.List;

/** 生成的一道题：题面、正确答案、打乱后的按钮选项（含正确答案） */
public record ChallengeQuestion(String question, String answer, List<String> options) {
}
