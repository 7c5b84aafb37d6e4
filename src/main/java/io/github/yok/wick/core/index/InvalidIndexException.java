package io.github.yok.wick.core.index;

import lombok.Getter;

/**
 * 真空に対して許可されない軌道空間で添字を生成しようとした場合に発生する例外です。
 */
@Getter
public class InvalidIndexException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 指定された軌道空間です。
     */
    private final Space space;

    /**
     * 指定された真空です。
     */
    private final Vacuum vacuum;

    /**
     * 例外を生成します。
     *
     * @param name 添字名です
     * @param space 指定された軌道空間です
     * @param vacuum 指定された真空です
     */
    public InvalidIndexException(String name, Space space, Vacuum vacuum) {
        super("真空 " + vacuum + " では軌道空間 " + space + " を使用できません: index=" + name);
        this.space = space;
        this.vacuum = vacuum;
    }
}
