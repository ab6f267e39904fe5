package com.eainde.nlg.planner;

import com.eainde.nlg.model.Message;

/** Candidate with a context dependent score, only valid for one satellite selection step. */
record ScoredMessage(double score, Message message) {

    ScoredMessage withScore(double newScore) {
        return new ScoredMessage(newScore, message);
    }
}
