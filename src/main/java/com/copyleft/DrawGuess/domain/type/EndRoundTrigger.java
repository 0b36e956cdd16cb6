package com.copyleft.DrawGuess.domain.type;

public enum EndRoundTrigger {
    TIME_UP,       // 라운드 타이머 만료
    CORRECT_GUESS, // 정답자 발생 후 축하 딜레이 종료
    MANUAL,        // end-round 요청 (방장/출제자)
    DRAWER_LEFT    // 출제자 퇴장
}
