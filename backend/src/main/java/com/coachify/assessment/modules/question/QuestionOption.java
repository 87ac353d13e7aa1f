package com.coachify.assessment.modules.question;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuestionOption {
    private String id; // referenced by McqAnswer/MsqAnswer option ids
    private String text;
    private String imageUrl;
}
