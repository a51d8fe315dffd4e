package uk.gegc.xpeconomy.features.attempt.application;

/**
 * Result handed over by the quiz-grading subsystem.
 */
public record QuizGrade(int scorePct, int wpmUsed) {}
