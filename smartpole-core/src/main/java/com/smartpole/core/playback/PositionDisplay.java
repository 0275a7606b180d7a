package com.smartpole.core.playback;

/**
 * 进度条一类的显示控件。程序写入的取值不得被当作用户拖动回传。
 */
public interface PositionDisplay {

    void setRange(long durationNanos);

    void setValue(long positionNanos);

    PositionDisplay NONE = new PositionDisplay() {
        @Override
        public void setRange(long durationNanos) {
        }

        @Override
        public void setValue(long positionNanos) {
        }
    };
}
