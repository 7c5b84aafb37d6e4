package io.github.yok.wick.core.contraction;

import io.github.yok.wick.core.index.Vacuum;
import lombok.Getter;

/**
 * 縮約計算が未対応の真空で実行しようとした場合に発生する例外です。
 */
@Getter
public class UnsupportedVacuumException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 指定された真空です。
     */
    private final Vacuum vacuum;

    /**
     * 例外を生成します。
     *
     * @param vacuum 未対応の真空です
     */
    public UnsupportedVacuumException(Vacuum vacuum) {
        super("この真空での Wick 展開は未対応です（PHYSICAL のみ対応）: " + vacuum);
        this.vacuum = vacuum;
    }
}
