package com.frontline.dto;

import com.frontline.model.PushStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StopPushRequest {

    private PushStatus reason;

    public PushStatus getReason() {
        return reason != null ? reason : PushStatus.CANCELLED;
    }
}
